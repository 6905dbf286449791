package com.astroinsight.astroinsight_backend.dialogue;

import com.astroinsight.astroinsight_backend.coder.DatasetCatalog;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;
import com.astroinsight.astroinsight_backend.model.session.DialogueState;
import com.astroinsight.astroinsight_backend.model.session.DialogueTurn;
import com.astroinsight.astroinsight_backend.model.session.Requirements;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Bounded clarification dialogue in front of code generation.
 *
 * Each user message is checked in order: turn limit reached → PROCEED, confirm keyword → PROCEED,
 * cancel keyword → CANCEL. Anything else is mined for requirements, which only ever accumulate,
 * and answered with a follow-up question (ASK) or a request for confirmation (CONFIRM).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DialogueManager {

    static final Set<String> CONFIRM_KEYWORDS = Set.of("done", "confirm", "完成", "确认", "执行");
    static final Set<String> CANCEL_KEYWORDS  = Set.of("quit", "exit", "q", "cancel", "退出", "取消");

    private static final Set<String> COURTESY_WORDS = Set.of(
            "ok", "okay", "alright", "yes", "yep", "please", "thanks", "thank", "you",
            "so", "then", "now", "i", "i'm", "im", "am", "we", "we're", "are", "all", "it");
    private static final Pattern WORD_SEPARATORS = Pattern.compile("[\\s,;:!?.，。！？、]+");

    private final DatasetCatalog catalog;

    // ── Public API ────────────────────────────────────────────────────────────

    /** Opens a dialogue at turn 1 with whatever the initial request already tells us. */
    public DialogueDecision start(String request, int maxTurns) {
        Requirements initial = RequirementExtractor.extract(request, datasetNames());
        DialogueState state = DialogueState.builder()
                .dialogueId(UUID.randomUUID().toString())
                .originalRequest(request)
                .turnCount(1)
                .maxTurns(maxTurns)
                .requirements(initial)
                .build();

        DialogueDecision.Action action = initial.isActionable()
                ? DialogueDecision.Action.CONFIRM
                : DialogueDecision.Action.ASK;
        String reply = reply(action, state);
        state.getHistory().add(new DialogueTurn(1, request, reply, Instant.now()));
        log.debug("Dialogue {} opened, actionable={}", state.getDialogueId(), initial.isActionable());
        return new DialogueDecision(action, reply, state);
    }

    public DialogueDecision handle(DialogueState state, String input) {
        String text = input == null ? "" : input.strip();

        if (state.getTurnCount() >= state.getMaxTurns()) {
            state.setStatus(DialogueState.Status.COMPLETED);
            log.info("Dialogue {} hit the turn limit ({}), proceeding", state.getDialogueId(), state.getMaxTurns());
            return new DialogueDecision(DialogueDecision.Action.PROCEED,
                    "Turn limit reached, generating with the requirements collected so far.", state);
        }
        if (matchesAny(text, CONFIRM_KEYWORDS)) {
            state.setStatus(DialogueState.Status.COMPLETED);
            return new DialogueDecision(DialogueDecision.Action.PROCEED, "Confirmed, generating the analysis.", state);
        }
        if (matchesAny(text, CANCEL_KEYWORDS)) {
            state.setStatus(DialogueState.Status.CANCELLED);
            return new DialogueDecision(DialogueDecision.Action.CANCEL, "Visualization request cancelled.", state);
        }

        state.getRequirements().merge(RequirementExtractor.extract(text, datasetNames()));
        state.setTurnCount(state.getTurnCount() + 1);

        DialogueDecision.Action action = state.getRequirements().isActionable()
                ? DialogueDecision.Action.CONFIRM
                : DialogueDecision.Action.ASK;
        String reply = reply(action, state);
        state.getHistory().add(new DialogueTurn(state.getTurnCount(), text, reply, Instant.now()));
        return new DialogueDecision(action, reply, state);
    }

    /** The original request plus everything clarified since, as one generation request. */
    public String buildGenerationRequest(DialogueState state) {
        StringBuilder sb = new StringBuilder(state.getOriginalRequest());
        String details = state.getRequirements().describe();
        if (!details.isEmpty()) {
            sb.append("\n\nClarified requirements:\n").append(details);
        }
        List<String> extra = state.getHistory().stream()
                .filter(t -> t.turn() > 1)
                .map(DialogueTurn::userInput)
                .filter(s -> !s.isBlank())
                .collect(Collectors.toList());
        if (!extra.isEmpty()) {
            sb.append("\n\nAdditional notes from the user:\n- ").append(String.join("\n- ", extra));
        }
        return sb.toString();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String reply(DialogueDecision.Action action, DialogueState state) {
        Requirements req = state.getRequirements();
        if (action == DialogueDecision.Action.CONFIRM) {
            return "Here is what I will do:\n" + req.describe()
                    + "\n\nReply 'confirm' to start, add more details, or 'cancel' to stop.";
        }
        StringBuilder sb = new StringBuilder();
        if (!req.isEmpty()) {
            sb.append("So far:\n").append(req.describe()).append("\n\n");
        }
        if (req.getDatasets().isEmpty()) {
            List<String> names = datasetNames();
            if (!names.isEmpty()) {
                sb.append("Which dataset should I use? Available: ").append(String.join(", ", names)).append(".\n");
            }
        }
        sb.append("What would you like to see? For example a scatter plot, a histogram, "
                + "a correlation or a distribution analysis.");
        sb.append(" (turn ").append(state.getTurnCount()).append(" of ").append(state.getMaxTurns()).append(')');
        return sb.toString();
    }

    private List<String> datasetNames() {
        return catalog.list().stream().map(DatasetInfo::name).collect(Collectors.toList());
    }

    /**
     * Latin keywords only count as a command: once courtesy words ("ok", "please", "i am") are
     * dropped, the keyword must be the single word left, so "Stokes Q" or "exit velocity" stay
     * requirements. CJK keywords match anywhere in the message.
     */
    static boolean matchesAny(String text, Set<String> keywords) {
        if (text.isEmpty()) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        String command = commandWord(lower);
        for (String keyword : keywords) {
            boolean hit = isCjk(keyword) ? lower.contains(keyword) : keyword.equals(command);
            if (hit) return true;
        }
        return false;
    }

    /** The one non-courtesy word of the message, or null when it says more (or less) than that. */
    private static String commandWord(String lower) {
        String found = null;
        for (String word : WORD_SEPARATORS.split(lower.strip())) {
            if (word.isEmpty() || COURTESY_WORDS.contains(word)) continue;
            if (found != null) return null;
            found = word;
        }
        return found;
    }

    private static boolean isCjk(String keyword) {
        return keyword.codePoints().anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN);
    }
}
