package com.stepwise.shell;

import com.stepwise.service.api.PracticeSessionService;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.shell.jline.PromptProvider;

/**
 * Shell prompt that names the problem in progress, e.g. {@code stepwise [solve-002] > }.
 * <p>
 * <strong>Note:</strong> Annotated with {@code proxyBeanMethods = false}, as the beans defined here
 * do not invoke other @Bean methods within the same configuration.
 * </p>
 */
@Configuration(proxyBeanMethods = false)
public class ShellPromptConfiguration {

    private static final String APP_NAME = "stepwise";
    private static final AttributedStyle NAME_STYLE = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.GREEN);
    private static final AttributedStyle PROBLEM_STYLE = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);

    @Bean
    public PromptProvider stepwisePrompt(PracticeSessionService practiceSessionService) {
        return () -> promptFor(practiceSessionService);
    }

    static AttributedString promptFor(PracticeSessionService practiceSessionService) {
        var prompt = new AttributedStringBuilder().append(APP_NAME, NAME_STYLE);
        practiceSessionService.getCurrentProblem().ifPresent(problem ->
                prompt.append(" [").append(problem.problemId(), PROBLEM_STYLE).append("]"));
        return prompt.append(" > ", NAME_STYLE).toAttributedString();
    }
}
