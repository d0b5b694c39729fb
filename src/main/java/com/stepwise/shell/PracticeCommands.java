package com.stepwise.shell;

import com.stepwise.model.OutcomeCode;
import com.stepwise.model.ProblemModel;
import com.stepwise.model.ProblemType;
import com.stepwise.model.SimplificationPattern;
import com.stepwise.model.StepValidationResult;
import com.stepwise.service.api.EquivalenceChecker;
import com.stepwise.service.api.PatternDetector;
import com.stepwise.service.api.PracticeSessionService;
import com.stepwise.service.api.ProblemLibraryService;
import com.stepwise.service.api.StepValidator;
import lombok.RequiredArgsConstructor;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.springframework.boot.info.BuildProperties;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.List;

/**
 * The Spring Shell component for step-by-step algebra practice.
 * <p>
 * This class handles all user commands (e.g., {@code start}, {@code step}, {@code hint}) and renders
 * the validation results with JLine {@link AttributedString} styling. Session state lives in the
 * {@link PracticeSessionService}; the analysis commands ({@code check}, {@code equiv}) work without an
 * active problem.
 * </p>
 * <p>
 * Commands that take an expression accept it either quoted or as separate words, so both
 * {@code s "x = 3"} and {@code s x = 3} work. An expression that starts with a minus sign has to be
 * quoted.
 * </p>
 */
@ShellComponent
@RequiredArgsConstructor
public class PracticeCommands {

    private final BuildProperties buildProperties;
    private final PracticeSessionService sessionService;
    private final ProblemLibraryService problemLibraryService;
    private final StepValidator stepValidator;
    private final PatternDetector patternDetector;
    private final EquivalenceChecker equivalenceChecker;
    private final Terminal terminal;

    // --- UI STYLES (Constants) ---
    private static final AttributedStyle STYLE_HEADER = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).bold();
    private static final AttributedStyle STYLE_LABEL = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN);
    private static final AttributedStyle STYLE_KEY = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.YELLOW);
    private static final AttributedStyle STYLE_INFO = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).italic();
    private static final AttributedStyle STYLE_ERROR = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.RED);
    private static final AttributedStyle STYLE_SUCCESS = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.GREEN).bold();
    private static final AttributedStyle STYLE_PROBLEM = AttributedStyle.DEFAULT.foreground(AttributedStyle.MAGENTA).bold();
    private static final AttributedStyle STYLE_EXPRESSION = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.GREEN);
    private static final AttributedStyle STYLE_FEEDBACK = AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).italic();

    // --- COMMANDS ---

    /**
     * Lists the problem library grouped by problem type.
     */
    @ShellMethod(key = "list", value = "List all available problems.")
    public void list() {
        printHeader("\nAvailable Problems:");

        for (ProblemType type : ProblemType.values()) {
            var problems = problemLibraryService.findByType(type);
            if (problems.isEmpty()) {
                continue;
            }
            printLabel("\n" + (type == ProblemType.SOLVE_EQUATION ? "Equations:" : "Expressions:"));
            problems.forEach(problem -> {
                var formattedLine = new AttributedStringBuilder()
                        .append("  - ")
                        .style(STYLE_KEY).append(String.format("%-14s", problem.problemId()))
                        .style(AttributedStyle.DEFAULT).append(String.format(" | %-7s | ", problem.difficulty().label()))
                        .style(STYLE_EXPRESSION).append(problem.problemStatement())
                        .toAnsi();
                terminal.writer().println(formattedLine);
            });
        }
        printInfo("\nType 'start [problem_id]' to begin (e.g., 'start solve-003').");
    }

    /**
     * Starts a problem from the library and shows its statement.
     *
     * @param problemId The problem identifier shown by {@code list}.
     */
    @ShellMethod(key = "start", value = "Start working on a problem.")
    public void start(@ShellOption(help = "The problem id (e.g., 'solve-003').") String problemId) {
        try {
            var problem = sessionService.startProblem(problemId);
            displayProblem(problem);
        } catch (IllegalArgumentException e) {
            printError("Error: " + e.getMessage() + ". Use 'list' to see the available problems.");
        }
    }

    /**
     * Submits the next step of the solution.
     *
     * @param inputParts The words forming the step (captured as an array to avoid quoting requirements).
     */
    @ShellMethod(key = {"s", "step"}, value = "Submit your next step.")
    public void step(@ShellOption(arity = Integer.MAX_VALUE, help = "Your step, e.g. 3x = 9.") String[] inputParts) {
        if (sessionService.getCurrentProblem().isEmpty()) {
            printInfo("There is no active problem. Use 'start' to begin.");
            return;
        }
        var input = join(inputParts);
        var history = sessionService.getHistory();
        var previousStep = history.get(history.size() - 1);

        var result = sessionService.submitStep(input);
        displayResult(result);

        if (result.shouldAdvance()) {
            var operation = stepValidator.analyzeStepOperation(previousStep, input);
            if (operation.isValid()) {
                printInfo("(" + operation.description() + ")");
            }
        }
        if (result.result() == OutcomeCode.CORRECT_FINAL_STEP || sessionService.isSolved()) {
            printSuccess("\nProblem solved! Type 'list' to pick another one.");
        }
    }

    /**
     * Shows hints for an expression, or for the last accepted step when none is given.
     *
     * @param inputParts Optional expression to get hints for.
     */
    @ShellMethod(key = "hint", value = "Get hints for an expression or for your last step.")
    public void hint(@ShellOption(arity = Integer.MAX_VALUE, defaultValue = ShellOption.NULL,
            help = "The expression to get hints for (optional).") String[] inputParts) {
        if (sessionService.getCurrentProblem().isEmpty()) {
            printInfo("There is no active problem. Use 'start' to begin.");
            return;
        }
        sessionService.getHints(join(inputParts)).forEach(hint -> printFeedback("Hint: " + hint));
    }

    /**
     * Prints the problem statement followed by every accepted step.
     */
    @ShellMethod(key = "history", value = "Show the steps you have completed so far.")
    public void history() {
        var history = sessionService.getHistory();
        if (history.isEmpty()) {
            printInfo("No active problem. Use 'start' to begin.");
            return;
        }
        printHeader("\nYour work:");
        for (int i = 0; i < history.size(); i++) {
            var label = i == 0 ? "[start] " : "[%d] ".formatted(i);
            terminal.writer().println(new AttributedStringBuilder()
                    .style(STYLE_KEY).append(String.format("%-8s", label))
                    .style(STYLE_EXPRESSION).append(history.get(i))
                    .toAnsi());
        }
        printSeparator();
    }

    /**
     * Displays the current status of the session (e.g., "Steps accepted: 2 | Steps remaining: 1").
     */
    @ShellMethod(key = "status", value = "Check your progress on the current problem.")
    public void status() {
        printLabel(sessionService.getStatus());
    }

    /**
     * Reveals the remaining steps of the worked solution.
     */
    @ShellMethod(key = "next-steps", value = "Reveal the remaining steps of the worked solution.")
    public void nextSteps() {
        if (sessionService.getCurrentProblem().isEmpty()) {
            printInfo("There is no active problem. Use 'start' to begin.");
            return;
        }
        var remaining = sessionService.getExpectedNextSteps();
        if (remaining.isEmpty()) {
            printInfo("There are no steps left.");
            return;
        }
        printHeader("\nRemaining steps:");
        remaining.forEach(step -> terminal.writer().println(new AttributedString("  " + step, STYLE_EXPRESSION).toAnsi()));
        terminal.writer().flush();
    }

    /**
     * Analyses any expression or equation for simplification opportunities.
     *
     * @param inputParts The expression to analyse.
     */
    @ShellMethod(key = "check", value = "Check whether an expression can be simplified further.")
    public void check(@ShellOption(arity = Integer.MAX_VALUE, help = "The expression or equation to check.") String[] inputParts) {
        var input = join(inputParts);
        if (input.isBlank()) {
            printError("Please provide an expression after the 'check' command.");
            return;
        }
        var analysis = patternDetector.analyze(input);
        if (analysis.isFullySimplified()) {
            printSuccess("'" + input + "' is fully simplified.");
            return;
        }
        if (analysis.patterns().isEmpty() && !analysis.hasUnsimplifiedOperations()) {
            printError("Could not analyse '" + input + "'.");
            return;
        }
        printHeader("\nSimplification opportunities in '" + input + "':");
        List<SimplificationPattern> patterns = analysis.patterns();
        patternDetector.feedbackFor(patterns).forEach(this::printFeedback);
        if (patterns.isEmpty()) {
            printFeedback("Look for coefficients of 1 or -1 that can be dropped.");
        }
        terminal.writer().flush();
    }

    /**
     * Compares two expressions, or two equations, for equivalence.
     *
     * @param first  The first expression, in quotes if it contains spaces.
     * @param second The second expression, in quotes if it contains spaces.
     */
    @ShellMethod(key = "equiv", value = "Check whether two expressions or equations are equivalent.")
    public void equiv(@ShellOption(help = "The first expression, quoted.") String first,
                      @ShellOption(help = "The second expression, quoted.") String second) {
        if (equivalenceChecker.areEquivalent(first, second)) {
            printSuccess("'" + first + "' and '" + second + "' are equivalent.");
        } else {
            printError("'" + first + "' and '" + second + "' are not equivalent.");
        }
    }

    /**
     * Abandons the current problem.
     */
    @ShellMethod(key = "reset", value = "Abandon the current problem.")
    public void reset() {
        sessionService.reset();
        printInfo("Session cleared. Use 'start' to begin a new problem.");
    }

    /**
     * Outputs the current version of the CLI application from build properties.
     */
    @ShellMethod(key = "version", value = "Display the application version.")
    public void version() {
        terminal.writer().println("stepwise-cli version " + buildProperties.getVersion());
        terminal.writer().flush();
    }

    // --- INTERNAL HELPERS ---

    private static String join(String[] parts) {
        return parts == null ? "" : String.join(" ", parts).trim();
    }

    private void displayProblem(ProblemModel problem) {
        var separator = "─".repeat(terminal.getWidth());
        terminal.writer().println(new AttributedStringBuilder()
                .append("\n").style(STYLE_HEADER).append(separator).append("\n")
                .style(STYLE_PROBLEM).append(problem.title()).append(" (").append(problem.difficulty().label()).append(")\n")
                .style(STYLE_HEADER).append(separator).append("\n\n")
                .style(STYLE_EXPRESSION).append("  ").append(problem.problemStatement()).append("\n\n")
                .style(STYLE_HEADER).append(separator)
                .toAnsi());
        printInfo("\nType 's [your step]' to submit a step, or 'hint' if you're stuck.");
    }

    /**
     * Renders a validation result: the outcome line followed by any simplification feedback.
     */
    private void displayResult(StepValidationResult result) {
        switch (result.result()) {
            case CORRECT_FINAL_STEP -> printSuccess("Correct! That is the final answer.");
            case CORRECT_INTERMEDIATE_STEP -> printSuccess("Correct step. Keep going!");
            case CORRECT_BUT_NOT_SIMPLIFIED -> printSuccess("Correct, but this can still be simplified.");
            case VALID_BUT_NO_PROGRESS -> printInfo("That is valid, but it does not bring you closer to the answer.");
            case EQUIVALENCE_FAILURE -> printError("Not quite. That step does not follow from your previous work.");
            case PARSING_ERROR -> printError("Could not read your input: " + result.errorMessage());
        }
        result.simplificationFeedback().forEach(this::printFeedback);
    }

    // --- PRINTER UTILITIES ---

    private void printHeader(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_HEADER).toAnsi());
        printSeparator();
    }

    private void printLabel(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_LABEL).toAnsi());
        terminal.writer().flush();
    }

    private void printInfo(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_INFO).toAnsi());
        terminal.writer().flush();
    }

    private void printError(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_ERROR).toAnsi());
        terminal.writer().flush();
    }

    private void printSuccess(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_SUCCESS).toAnsi());
        terminal.writer().flush();
    }

    private void printFeedback(String text) {
        terminal.writer().println(new AttributedString("  • " + text, STYLE_FEEDBACK).toAnsi());
        terminal.writer().flush();
    }

    private void printSeparator() {
        terminal.writer().println("─".repeat(40));
    }
}
