package secenv.prim.time;

import java.time.Instant;

/**
 * A wall clock can tell you the date and time.  Containers are stamped with
 * it, but nothing depends on the stamp being right: computers disagree about
 * the time, and the stamp is only shown to people.
 *
 * <p>Tests substitute a fixed clock.
 */
public interface UnreliableWallClock {
  Instant now();

  UnreliableWallClock SYSTEM_CLOCK = Instant::now;
}
