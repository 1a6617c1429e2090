package secenv.vault;

import secenv.prim.MalformedDataException;
import secenv.prim.PreconditionFailed;
import secenv.prim.storage.GitHubContentsStore;
import secenv.prim.storage.RemoteBlobStore;
import secenv.prim.storage.S3BlobStore;
import secenv.prim.time.UnreliableWallClock;
import secenv.vault.impls.AuthenticatedCipher;
import secenv.vault.impls.BackerUpper;
import secenv.vault.impls.KeyDerivation;
import secenv.vault.impls.KeyFiles;
import secenv.vault.impls.KeyResolver;
import secenv.vault.impls.KeyValidator;
import secenv.vault.impls.ObfuscatedContainerFormat;
import secenv.vault.types.BackupInfo;
import secenv.vault.types.BackupNotFound;
import secenv.vault.types.BackupResult;
import secenv.vault.types.DecryptionFailure;
import secenv.vault.types.ExportResult;
import secenv.vault.types.InvalidKeyConfig;
import secenv.vault.types.KeyOptions;
import secenv.vault.types.NoFilesFound;
import secenv.vault.types.PasswordStrength;
import secenv.vault.types.RemoteConfig;
import secenv.vault.types.RemoteNotFound;
import secenv.vault.types.RestoreResult;
import secenv.vault.types.WeakKey;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Main {

  private static final String DEFAULT_S3_REGION = "us-east-2";

  private static void showHelp(Options options) {
    new HelpFormatter().printHelp("secenv [options]", options);
  }

  private static Options buildOptions() {
    Options options = new Options();

    // flags
    options.addOption("h", "help", false, "Show help and quit");
    options.addOption(Option.builder("k").longOpt("key").hasArg().optionalArg(true).desc("Encryption password (prompts if you give an empty argument)").build());
    options.addOption("f", "key-file", true, "Use the contents of FILE as the key instead of a password");
    options.addOption(Option.builder().longOpt("remote").hasArg().argName("github|s3").desc("Remote for --push and --pull (default: github)").build());
    options.addOption(Option.builder().longOpt("s3-bucket").hasArg().desc("S3 bucket for --remote s3 (overrides the config file)").build());
    options.addOption(Option.builder().longOpt("s3-region").hasArg().desc("S3 region for --remote s3 (default: " + DEFAULT_S3_REGION + ")").build());

    // actions
    options.addOption("b", "backup", false, "Back up the .env files in the current directory");
    options.addOption("r", "restore", false, "Restore .env files from this project's backup");
    options.addOption(Option.builder().longOpt("export").hasArg().argName("FILE").desc("Copy this project's backup to FILE").build());
    options.addOption(Option.builder().longOpt("import").hasArg().argName("FILE").desc("Adopt the backup in FILE and restore from it").build());
    options.addOption(Option.builder().longOpt("push").desc("Back up, then upload the backup to the remote").build());
    options.addOption(Option.builder().longOpt("pull").desc("Download the backup from the remote and restore from it").build());
    options.addOption("i", "info", false, "Show what this project's backup contains (no key needed)");
    options.addOption(Option.builder().longOpt("generate-key").hasArg().argName("FILE").desc("Write a new random key file").build());
    options.addOption(Option.builder().longOpt("check-password").hasArg().argName("PASSWORD").desc("Check a password against the strength policy").build());
    options.addOption(Option.builder().longOpt("github-token").hasArg().desc("Save a GitHub access token in the config file").build());
    options.addOption(Option.builder().longOpt("github-repo").hasArg().argName("OWNER/NAME").desc("Save the GitHub repository to push to in the config file").build());

    return options;
  }

  public static void main(String[] args) throws IOException {
    Options options = buildOptions();

    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      System.err.println("Failed to parse options: " + e);
      showHelp(options);
      System.exit(1);
      return;
    }

    if (cli.hasOption('h')) {
      showHelp(options);
      return;
    }

    final boolean backup = cli.hasOption("backup");
    final boolean restore = cli.hasOption("restore");
    final boolean push = cli.hasOption("push");
    final boolean pull = cli.hasOption("pull");
    final boolean info = cli.hasOption("info");
    final @Nullable String exportTarget = cli.getOptionValue("export");
    final @Nullable String importSource = cli.getOptionValue("import");
    final @Nullable String newKeyFile = cli.getOptionValue("generate-key");
    final @Nullable String passwordToCheck = cli.getOptionValue("check-password");
    final boolean configure = cli.hasOption("github-token") || cli.hasOption("github-repo");

    if (!backup && !restore && !push && !pull && !info && exportTarget == null && importSource == null
            && newKeyFile == null && passwordToCheck == null && !configure) {
      System.err.println("No action specified. Did you mean to pass '--backup'?");
      showHelp(options);
      System.exit(1);
      return;
    }

    // ------------------------------------------------------------------------------
    // Actions that need no key

    if (passwordToCheck != null) {
      PasswordStrength strength = new KeyValidator().validate(passwordToCheck);
      System.out.println(strength.message() + " (score " + strength.score() + "/" + PasswordStrength.Requirement.values().length + ')');
      if (!strength.strong()) {
        System.exit(1);
      }
    }

    if (newKeyFile != null) {
      Path target = Paths.get(newKeyFile);
      try {
        KeyFiles.generate(target);
      } catch (FileAlreadyExistsException e) {
        System.err.println("Key file " + target + " already exists; refusing to overwrite it");
        System.exit(1);
      }
      System.out.println("Wrote a new key to " + target);
      System.out.println("Keep it safe: backups made with it cannot be restored without it.");
    }

    final Path storageRoot = StorageLocations.defaultRoot();
    final ConfigFile configFile = new ConfigFile(storageRoot);

    if (configure) {
      RemoteConfig updated = loadConfig(configFile).withGitHub(cli.getOptionValue("github-token"), cli.getOptionValue("github-repo"));
      if (updated.getGithubRepo() != null && !ConfigFile.isLegalRepo(updated.getGithubRepo())) {
        fail("GitHub repository must look like OWNER/NAME, got '" + updated.getGithubRepo() + '\'');
      }
      configFile.save(updated);
      System.out.println("Saved configuration to " + configFile.path());
    }

    // ------------------------------------------------------------------------------
    // Set up actors

    final Path projectRoot = Paths.get("").toAbsolutePath();
    final BackerUpper backupper = new BackerUpper(
            storageRoot,
            new ObfuscatedContainerFormat(),
            new AuthenticatedCipher(new KeyDerivation()),
            new KeyResolver(),
            UnreliableWallClock.SYSTEM_CLOCK);

    if (info) {
      try {
        BackupInfo i = backupper.info(projectRoot);
        if (i == null) {
          System.out.println("No backup for project " + projectRoot.getFileName());
        } else {
          System.out.println("Project:   " + i.getProject() + " (" + i.getHash() + ')');
          System.out.println("Backed up: " + i.getTimestamp());
          System.out.println("Files:     " + String.join(", ", i.getFiles()));
        }
      } catch (MalformedDataException e) {
        fail("The backup for this project is corrupted: " + e.getMessage());
      }
    }

    if (!backup && !restore && !push && !pull && exportTarget == null && importSource == null) {
      return;
    }

    // ------------------------------------------------------------------------------
    // Do the work

    KeyOptions keyOptions = readKeyOptions(cli);

    try {
      if (backup) {
        BackupResult result = backupper.backup(projectRoot, keyOptions);
        System.out.println("Backed up " + result.getFiles().size() + " file(s) for " + result.getProject() + " to " + result.getContainer());
      }

      if (exportTarget != null) {
        ExportResult result = backupper.exportTo(projectRoot, keyOptions.getPassword() == null && keyOptions.getKeyFile() == null ? null : keyOptions, Paths.get(exportTarget));
        System.out.println("Exported " + result.getFileCount() + " file(s) from the backup of " + result.getTimestamp() + " to " + result.getExportPath());
      }

      if (restore) {
        report(backupper.restore(projectRoot, keyOptions));
      }

      if (importSource != null) {
        report(backupper.importFrom(projectRoot, keyOptions, Paths.get(importSource)));
      }

      if (push || pull) {
        RemoteConfig config = loadConfig(configFile);
        String remoteKind = cli.getOptionValue("remote", "github");
        switch (remoteKind) {
          case "github": {
            if (config.getGithubToken() == null || config.getGithubRepo() == null) {
              fail("No GitHub remote configured. Pass --github-token and --github-repo first.");
              return;
            }
            runRemote(backupper, projectRoot, keyOptions, GitHubContentsStore.connect(config.getGithubToken(), config.getGithubRepo()), push, pull);
            break;
          }
          case "s3": {
            String bucket = cli.getOptionValue("s3-bucket", config.getS3Bucket());
            if (bucket == null) {
              fail("No S3 bucket configured. Pass --s3-bucket.");
              return;
            }
            String region = cli.getOptionValue("s3-region", config.getS3Region() != null ? config.getS3Region() : DEFAULT_S3_REGION);
            try (S3Client s3 = S3Client.builder()
                    .credentialsProvider(DefaultCredentialsProvider.create())
                    .region(Region.of(region))
                    .build()) {
              runRemote(backupper, projectRoot, keyOptions, new S3BlobStore(s3, bucket), push, pull);
            }
            break;
          }
          default:
            fail("Unknown remote '" + remoteKind + "'; expected 'github' or 's3'");
        }
      }
    } catch (InvalidKeyConfig e) {
      fail(e.getMessage());
    } catch (WeakKey e) {
      fail(e.getMessage());
    } catch (NoFilesFound e) {
      fail(e.getMessage() + ". Backups include files named .env or .env.* (but not *.example or *.template).");
    } catch (BackupNotFound e) {
      fail(e.getMessage() + ". Run --backup first.");
    } catch (RemoteNotFound e) {
      fail(e.getMessage() + ". Run --push from a machine that has the files first.");
    } catch (MalformedDataException e) {
      fail("Not a valid backup: " + e.getMessage());
    } catch (DecryptionFailure e) {
      fail("Decryption failed; is the key right? (" + e.getMessage() + ')');
    } catch (PreconditionFailed e) {
      System.err.println("Another machine pushed a backup of this project while this one was pushing.");
      System.err.println("Error message: " + e.getMessage());
      System.err.println("Pull the other backup, or run the push again to overwrite it.");
      System.exit(1);
    }
  }

  private static RemoteConfig loadConfig(ConfigFile configFile) throws IOException {
    try {
      return configFile.load();
    } catch (MalformedDataException e) {
      fail(e.getMessage() + ". Fix or delete the file and try again.");
      return RemoteConfig.EMPTY;
    }
  }

  private static void runRemote(BackerUpper backupper, Path projectRoot, KeyOptions keyOptions, RemoteBlobStore remote, boolean push, boolean pull)
          throws IOException, InvalidKeyConfig, NoFilesFound, WeakKey, PreconditionFailed, RemoteNotFound, MalformedDataException, DecryptionFailure {
    if (push) {
      BackupResult result = backupper.push(projectRoot, keyOptions, remote);
      System.out.println("Pushed " + result.getFiles().size() + " file(s) for " + result.getProject() + " to " + remote);
    }
    if (pull) {
      report(backupper.pull(projectRoot, keyOptions, remote));
    }
  }

  private static KeyOptions readKeyOptions(CommandLine cli) {
    String password = null;
    if (cli.hasOption('k')) {
      password = cli.getOptionValue('k');
      if (password == null || password.isEmpty()) {
        password = Util.readPassword("Password");
        if (password == null) {
          fail("No password; refusing to proceed");
        }
      }
    }
    String keyFile = cli.getOptionValue('f');
    return new KeyOptions(password, keyFile != null ? Paths.get(keyFile) : null);
  }

  private static void report(RestoreResult result) {
    System.out.println("Restored " + result.getFiles().size() + " file(s) for " + result.getProject()
            + " from the backup of " + result.getTimestamp());
  }

  private static void fail(String message) {
    System.err.println("Error: " + message);
    System.exit(1);
  }

}
