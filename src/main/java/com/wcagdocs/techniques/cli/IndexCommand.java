package com.wcagdocs.techniques.cli;

import com.wcagdocs.techniques.cli.exception.OptionsValidationException;
import com.wcagdocs.techniques.cli.model.IndexOptions;
import com.wcagdocs.techniques.cli.output.IndexResultsPrinter;
import com.wcagdocs.techniques.cli.validation.IndexOptionsValidator;
import com.wcagdocs.techniques.index.IndexResult;
import com.wcagdocs.techniques.index.IndexerConfig;
import com.wcagdocs.techniques.index.TechniqueIndexGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command that builds the technique-to-criteria association index.
 */
@Command(
        name = "index",
        mixinStandardHelpOptions = true,
        version = "technique-associations 1.0.0",
        description = "Inverts per-criterion technique specifications into a per-technique association index."
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    @Mixin
    private IndexOptions options = new IndexOptions();

    private final IndexOptionsValidator validator = new IndexOptionsValidator();
    private final IndexResultsPrinter printer = new IndexResultsPrinter();

    @Override
    public Integer call() {
        IndexerConfig config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error(e.getMessage());
            return OptionsValidationException.EXIT_CODE;
        }

        printer.printBanner(config);
        IndexResult result = new TechniqueIndexGenerator(config).generate();

        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        printer.printSuccess(result);
        return 0;
    }
}
