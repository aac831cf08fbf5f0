package com.williamcallahan.docarchive.cli;

import com.williamcallahan.docarchive.service.management.ArchiveRunSummary;
import com.williamcallahan.docarchive.service.management.DocumentArchiver;
import com.williamcallahan.docarchive.service.management.DocumentDecrypter;
import com.williamcallahan.docarchive.service.management.DocumentRenamer;
import com.williamcallahan.docarchive.service.management.SanityCheckMessages;
import com.williamcallahan.docarchive.service.management.SanityChecker;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs a management command named by the first non-option argument, for example
 * {@code document_archiver --overwrite} or {@code decrypt_documents --passphrase=secret}. Does
 * nothing when no command is given.
 */
@Component
public class ManagementCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ManagementCommandRunner.class);

    static final String OVERWRITE_OPTION = "overwrite";
    static final String PASSPHRASE_OPTION = "passphrase";

    private final DocumentArchiver documentArchiver;
    private final DocumentRenamer documentRenamer;
    private final SanityChecker sanityChecker;
    private final DocumentDecrypter documentDecrypter;

    private int exitCode;

    public ManagementCommandRunner(DocumentArchiver documentArchiver,
                                   DocumentRenamer documentRenamer,
                                   SanityChecker sanityChecker,
                                   DocumentDecrypter documentDecrypter) {
        this.documentArchiver = documentArchiver;
        this.documentRenamer = documentRenamer;
        this.sanityChecker = sanityChecker;
        this.documentDecrypter = documentDecrypter;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> commandArgs = args.getNonOptionArgs();
        if (commandArgs.isEmpty()) {
            return;
        }
        Optional<ManagementCommand> command = ManagementCommand.fromName(commandArgs.get(0));
        if (command.isEmpty()) {
            log.error("Unknown management command: {}", commandArgs.get(0));
            exitCode = 2;
            return;
        }

        switch (command.get()) {
            case DOCUMENT_ARCHIVER -> {
                ArchiveRunSummary summary = documentArchiver.archiveAll(args.containsOption(OVERWRITE_OPTION));
                log.info("Archived {}, skipped {}, failed {}", summary.archived(), summary.skipped(), summary.failed());
                exitCode = summary.failed() > 0 ? 1 : 0;
            }
            case DOCUMENT_RENAMER -> documentRenamer.renameAll();
            case DOCUMENT_SANITY_CHECKER -> {
                SanityCheckMessages messages = sanityChecker.checkAndLog();
                exitCode = messages.hasError() ? 1 : 0;
            }
            case DECRYPT_DOCUMENTS -> decryptDocuments(args);
        }
    }

    private void decryptDocuments(ApplicationArguments args) throws Exception {
        List<String> passphrases = args.getOptionValues(PASSPHRASE_OPTION);
        String passphrase = passphrases == null || passphrases.isEmpty() ? null : passphrases.get(0);
        try {
            documentDecrypter.decryptAll(passphrase);
            exitCode = 0;
        } catch (IllegalStateException missingPassphrase) {
            log.error(missingPassphrase.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
