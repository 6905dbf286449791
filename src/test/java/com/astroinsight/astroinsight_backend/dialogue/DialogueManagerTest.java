package com.astroinsight.astroinsight_backend.dialogue;

import com.astroinsight.astroinsight_backend.coder.DatasetCatalog;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;
import com.astroinsight.astroinsight_backend.model.session.DialogueState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
@DisplayName("Dialogue manager")
class DialogueManagerTest {

    @Mock
    private DatasetCatalog catalog;

    private DialogueManager manager;

    @BeforeEach
    void setUp() {
        lenient().when(catalog.list()).thenReturn(List.of(
                new DatasetInfo("gaia", "/d/gaia.csv", List.of("ra", "dec", "mag")),
                new DatasetInfo("sdss", "/d/sdss.csv", List.of("z"))));
        manager = new DialogueManager(catalog);
    }

    @Test
    @DisplayName("A vague request gets one follow-up, then 'done' proceeds with what was collected")
    void vagueRequestThenDone() {
        // Given
        DialogueDecision opened = manager.start("visualize the data", 8);

        // Then
        assertThat(opened.action()).isEqualTo(DialogueDecision.Action.ASK);
        assertThat(opened.action().suspends()).isTrue();
        assertThat(opened.reply()).contains("Which dataset should I use? Available: gaia, sdss").endsWith("(turn 1 of 8)");
        assertThat(opened.state().getTurnCount()).isEqualTo(1);
        assertThat(opened.state().getHistory()).hasSize(1);

        // When
        DialogueDecision next = manager.handle(opened.state(), "done");

        // Then
        assertThat(next.action()).isEqualTo(DialogueDecision.Action.PROCEED);
        assertThat(next.state().getStatus()).isEqualTo(DialogueState.Status.COMPLETED);
        assertThat(manager.buildGenerationRequest(next.state())).isEqualTo("visualize the data");
    }

    @Test
    @DisplayName("A request that already names a chart asks for confirmation")
    void actionableRequestConfirms() {
        DialogueDecision opened = manager.start("scatter plot of gaia ra vs dec", 8);

        assertThat(opened.action()).isEqualTo(DialogueDecision.Action.CONFIRM);
        assertThat(opened.reply()).startsWith("Here is what I will do:");
        assertThat(opened.state().getRequirements().getDatasets()).containsExactly("gaia");
        assertThat(opened.state().getRequirements().getChartTypes()).containsExactly("scatter");
    }

    @Test
    @DisplayName("Requirements only accumulate across turns")
    void requirementsAccumulate() {
        // Given
        DialogueDecision opened = manager.start("scatter plot of gaia", 8);

        // When
        DialogueDecision next = manager.handle(opened.state(), "also a histogram where mag > 5");

        // Then
        assertThat(next.action()).isEqualTo(DialogueDecision.Action.CONFIRM);
        DialogueState state = next.state();
        assertThat(state.getTurnCount()).isEqualTo(2);
        assertThat(state.getRequirements().getChartTypes()).containsExactly("scatter", "histogram");
        assertThat(state.getRequirements().getDatasets()).containsExactly("gaia");
        assertThat(state.getRequirements().getFilters()).containsExactly("where mag > 5");

        String request = manager.buildGenerationRequest(state);
        assertThat(request).startsWith("scatter plot of gaia\n\nClarified requirements:\n");
        assertThat(request).contains("- chart types: scatter, histogram");
        assertThat(request).contains("Additional notes from the user:\n- also a histogram where mag > 5");
    }

    @Test
    @DisplayName("Cancel keywords end the dialogue, in English or Chinese")
    void cancel() {
        DialogueDecision english = manager.handle(manager.start("plot", 8).state(), "please cancel");
        DialogueDecision chinese = manager.handle(manager.start("plot", 8).state(), "取消吧");

        assertThat(english.action()).isEqualTo(DialogueDecision.Action.CANCEL);
        assertThat(english.state().getStatus()).isEqualTo(DialogueState.Status.CANCELLED);
        assertThat(chinese.action()).isEqualTo(DialogueDecision.Action.CANCEL);
    }

    @Test
    @DisplayName("Short keywords only match whole words")
    void shortKeywordsNeedWordBoundary() {
        DialogueDecision next = manager.handle(manager.start("plot", 8).state(), "quasar redshift please");

        assertThat(next.action()).isEqualTo(DialogueDecision.Action.ASK);
        assertThat(next.state().getTurnCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Keywords inside a requirement sentence are read as requirements, not commands")
    void keywordsInsideSentencesAreRequirements() {
        // When
        DialogueDecision stokes = manager.handle(manager.start("plot", 8).state(), "scatter plot of Stokes Q vs U");
        DialogueDecision velocity = manager.handle(manager.start("plot", 8).state(),
                "histogram of exit velocity, i am done with redshift cuts later");

        // Then
        assertThat(stokes.action()).isEqualTo(DialogueDecision.Action.CONFIRM);
        assertThat(stokes.state().getRequirements().getChartTypes()).contains("scatter");
        assertThat(velocity.action()).isEqualTo(DialogueDecision.Action.CONFIRM);
        assertThat(velocity.state().getRequirements().getChartTypes()).contains("histogram");
        assertThat(velocity.state().getStatus()).isNotEqualTo(DialogueState.Status.COMPLETED);
    }

    @Test
    @DisplayName("Reaching the turn limit proceeds without reading the message")
    void turnLimit() {
        // Given
        DialogueState state = manager.start("plot", 2).state();
        state = manager.handle(state, "something about gaia").state();
        assertThat(state.getTurnCount()).isEqualTo(2);

        // When
        DialogueDecision last = manager.handle(state, "cancel");

        // Then
        assertThat(last.action()).isEqualTo(DialogueDecision.Action.PROCEED);
        assertThat(last.state().getStatus()).isEqualTo(DialogueState.Status.COMPLETED);
        assertThat(last.state().getRequirements().getDatasets()).containsExactly("gaia");
    }

    @Test
    @DisplayName("Keyword matching")
    void matchesAny() {
        assertThat(DialogueManager.matchesAny("Confirm", DialogueManager.CONFIRM_KEYWORDS)).isTrue();
        assertThat(DialogueManager.matchesAny("好的，确认执行", DialogueManager.CONFIRM_KEYWORDS)).isTrue();
        assertThat(DialogueManager.matchesAny("q", DialogueManager.CANCEL_KEYWORDS)).isTrue();
        assertThat(DialogueManager.matchesAny("undone work", DialogueManager.CONFIRM_KEYWORDS)).isFalse();
        assertThat(DialogueManager.matchesAny("", DialogueManager.CANCEL_KEYWORDS)).isFalse();
        assertThat(DialogueManager.matchesAny("ok, done", DialogueManager.CONFIRM_KEYWORDS)).isTrue();
        assertThat(DialogueManager.matchesAny("Done!", DialogueManager.CONFIRM_KEYWORDS)).isTrue();
        assertThat(DialogueManager.matchesAny("cancel please", DialogueManager.CANCEL_KEYWORDS)).isTrue();
        assertThat(DialogueManager.matchesAny("Stokes Q vs U", DialogueManager.CANCEL_KEYWORDS)).isFalse();
        assertThat(DialogueManager.matchesAny("exit velocity", DialogueManager.CANCEL_KEYWORDS)).isFalse();
        assertThat(DialogueManager.matchesAny("done with the cuts", DialogueManager.CONFIRM_KEYWORDS)).isFalse();
    }
}
