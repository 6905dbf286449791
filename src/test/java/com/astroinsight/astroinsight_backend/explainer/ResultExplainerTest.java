package com.astroinsight.astroinsight_backend.explainer;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.model.code.CodeErrorType;
import com.astroinsight.astroinsight_backend.model.code.CodeTask;
import com.astroinsight.astroinsight_backend.model.code.Complexity;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;
import com.astroinsight.astroinsight_backend.model.code.ExecutionResult;
import com.astroinsight.astroinsight_backend.model.code.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Result explainer")
class ResultExplainerTest {

    @Mock
    private ClassifierPort classifier;

    private AgentProperties properties;
    private ResultExplainer explainer;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        explainer = new ResultExplainer(classifier, properties);
    }

    @Test
    @DisplayName("The prompt carries the request, the printed output and the figure names")
    void explainsSuccessfulTask() throws Exception {
        // Given
        when(classifier.classify(anyString())).thenReturn("""
                SUMMARY: The sample peaks at redshift 0.1.
                It thins out beyond 0.4.
                INSIGHTS:
                - Most galaxies are nearby.
                - The tail is sparse.
                """);

        // When
        Optional<Explanation> explanation = explainer.explain(succeededTask());

        // Then
        assertThat(explanation).hasValueSatisfying(e -> {
            assertThat(e.summary()).isEqualTo("The sample peaks at redshift 0.1. It thins out beyond 0.4.");
            assertThat(e.insights()).containsExactly("Most galaxies are nearby.", "The tail is sparse.");
        });
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(classifier).classify(prompt.capture());
        assertThat(prompt.getValue())
                .contains("redshift distribution of galaxies")
                .contains("galaxies (complexity MODERATE)")
                .contains("mean z = 0.12")
                .contains("- z_hist.png")
                .doesNotContain("/out/run/z_hist.png");
    }

    @Test
    @DisplayName("A classifier failure degrades to no explanation")
    void classifierFailure() throws Exception {
        when(classifier.classify(anyString())).thenThrow(new ClassifierException("rate limited"));

        assertThat(explainer.explain(succeededTask())).isEmpty();
    }

    @Test
    @DisplayName("Failed tasks and a disabled explainer never call the classifier")
    void skipped() {
        CodeTask failed = CodeTask.create("s1", "plot");
        failed.fail(CodeErrorType.NO_DATASETS, "No datasets found");
        assertThat(explainer.explain(failed)).isEmpty();

        properties.getExplainer().setEnabled(false);
        assertThat(explainer.explain(succeededTask())).isEmpty();

        verifyNoInteractions(classifier);
    }

    @Test
    @DisplayName("Replies that ignore the layout still yield prose and bullets; blank replies yield nothing")
    void parseLooseReplies() {
        Optional<Explanation> loose = ResultExplainer.parse(
                "The histogram is bimodal.\n1. Two populations\n2) A gap near z = 0.3\n* Few outliers", 2);

        assertThat(loose).hasValueSatisfying(e -> {
            assertThat(e.summary()).isEqualTo("The histogram is bimodal.");
            assertThat(e.insights()).containsExactly("Two populations", "A gap near z = 0.3");
        });
        assertThat(ResultExplainer.parse("  \n ", 5)).isEmpty();
        assertThat(ResultExplainer.parse(null, 5)).isEmpty();
    }

    @Test
    @DisplayName("Rendering lists the insights under the summary")
    void render() {
        assertThat(new Explanation("Flat.", List.of()).render()).isEqualTo("Summary:\nFlat.");
        assertThat(new Explanation("Flat.", List.of("No trend")).render())
                .isEqualTo("Summary:\nFlat.\n\nKey insights:\n- No trend");
    }

    private static CodeTask succeededTask() {
        CodeTask task = CodeTask.create("s1", "redshift distribution of galaxies");
        task.setDataset(new DatasetInfo("galaxies", "/d/galaxies.csv", List.of("z")));
        task.setComplexity(Complexity.MODERATE);
        task.addGeneratedCode("print('mean z = 0.12')");
        task.getExecutionHistory().add(ExecutionResult.start("/out/run")
                .finish(ExecutionStatus.SUCCESS, "mean z = 0.12", "", 0, false,
                        List.of("/out/run/z_hist.png"), List.of()));
        task.complete();
        return task;
    }
}
