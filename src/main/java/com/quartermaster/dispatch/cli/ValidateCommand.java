package com.quartermaster.dispatch.cli;

import com.quartermaster.core.graph.DependencyValidator;
import com.quartermaster.core.graph.ValidationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: quartermaster validate
 * <p>
 * Checks task dependencies for dangling references, self references, duplicates,
 * cancelled blockers and cycles. Exits with 1 when any error is found.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate task dependencies")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"--prd"}, description = "Only validate tasks of this PRD")
    private String prdId;

    private final DependencyValidator validator;

    public ValidateCommand(DependencyValidator validator) {
        this.validator = validator;
    }

    @Override
    public Integer call() {
        ValidationReport report = validator.validate(prdId);

        ConsoleOutput.info("Checked " + report.tasksChecked() + " task" + (report.tasksChecked() != 1 ? "s" : ""));
        report.issues().forEach(ConsoleOutput::issue);

        if (report.isValid()) {
            ConsoleOutput.success("Dependencies valid"
                    + (report.warnings().isEmpty() ? "" : " (" + report.warnings().size() + " warning(s))"));
            return 0;
        }
        ConsoleOutput.error(report.errors().size() + " error(s) found");
        return 1;
    }
}
