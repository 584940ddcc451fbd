package com.example.roster.cli;

import com.example.roster.config.ExtractionDefaults;
import com.example.roster.dto.ExtractionRequest;
import com.example.roster.dto.ExtractionResult;
import com.example.roster.service.RosterExtractionException;
import com.example.roster.service.RosterExtractionService;
import com.example.roster.service.output.RecordWriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses the command line, runs one extraction and writes the rows.
 */
@Component
public class RosterCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(RosterCommandLineRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final RosterExtractionService extractionService;
    private final RecordWriterFactory recordWriterFactory;
    private final ExtractionDefaults defaults;

    private int exitCode = EXIT_OK;

    public RosterCommandLineRunner(RosterExtractionService extractionService,
                                   RecordWriterFactory recordWriterFactory,
                                   ExtractionDefaults defaults) {
        this.extractionService = extractionService;
        this.recordWriterFactory = recordWriterFactory;
        this.defaults = defaults;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int execute(String... args) {
        CliArguments arguments = new CliArguments();
        CommandLine commandLine = new CommandLine(arguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        ExtractionRequest request = toRequest(arguments);
        Path out = arguments.out();
        try {
            ExtractionResult result = extractionService.extract(request);
            recordWriterFactory.forTarget(out).write(result.getRecords(), out);
            logger.info("Wrote {} rows to {}", result.getRecords().size(), out);
            if (!result.getFailedPages().isEmpty()) {
                logger.warn("Pages skipped after read errors: {}", result.getFailedPages());
            }
            return EXIT_OK;
        } catch (IOException | RosterExtractionException e) {
            logger.error("Extraction failed for {}: {}", request.getPdfFile(), e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    ExtractionRequest toRequest(CliArguments arguments) {
        return ExtractionRequest.builder()
                .pdfFile(arguments.pdf())
                .layout(arguments.layout())
                .xThreshold(arguments.xThreshold() != null ? arguments.xThreshold() : defaults.getXThreshold())
                .forceOcr(arguments.forceOcr())
                .ocrFallback(arguments.ocrFallback() || defaults.isOcrFallback())
                .ocrDpi(arguments.ocrDpi() != null ? arguments.ocrDpi() : defaults.getOcrDpi())
                .ocrLanguage(arguments.ocrLanguage() != null ? arguments.ocrLanguage() : defaults.getOcrLanguage())
                .tessdataPath(arguments.tessdataPath() != null ? arguments.tessdataPath() : defaults.getTessdataPath())
                .tesseractLibraryPath(arguments.tesseractLibraryPath())
                .build();
    }
}
