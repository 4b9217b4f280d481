package com.mystery.game_state;

import com.mystery.ai_engine.InterrogationResult;
import com.mystery.ai_engine.NarrativeOrchestrator;
import com.mystery.ai_engine.PersonalityAnalyzer;
import com.mystery.ai_engine.SnippetWriter;
import com.mystery.ai_engine.SuspectActor;
import com.mystery.ai_engine.TextGenerationService;
import com.mystery.analysis.ConsistencyChecker;
import com.mystery.analysis.ContradictionAnalysis;
import com.mystery.case_model.CaseCharacter;
import com.mystery.case_model.CaseModel;
import com.mystery.case_model.Clue;
import com.mystery.case_model.SuspectRoster;
import com.mystery.gossip.CommunicationRecord;
import com.mystery.gossip.GossipMemoryService;
import com.mystery.gossip.GossipPropagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * Everything one game owns: the case, the orchestrator, one actor per living suspect, the gossip machinery,
 * the investigation log and the background tasks. Closing the session stops new background work.
 */
public class GameSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    private static final int MAX_KEY_EVIDENCE = 3;
    private static final int MAX_MISLEAD_REASONS = 2;

    private final String id;
    private final CaseModel caseModel;
    private final NarrativeOrchestrator orchestrator;
    private final Map<String, SuspectActor> actors;
    private final GossipPropagator propagator;
    private final SnippetWriter snippetWriter;
    private final InvestigationLog investigationLog = new InvestigationLog();
    private final BackgroundTasks tasks;
    private final boolean gossipEnabled;
    private volatile boolean closed;

    public GameSession(String id, CaseModel caseModel, TextGenerationService textService, GossipMemoryService memory,
                       ConsistencyChecker consistencyChecker, BackgroundTasks tasks, Random random, boolean gossipEnabled) {
        this.id = id;
        this.caseModel = caseModel;
        this.tasks = tasks;
        this.gossipEnabled = gossipEnabled;
        this.orchestrator = new NarrativeOrchestrator(caseModel, textService, consistencyChecker);
        this.snippetWriter = new SnippetWriter(textService);

        PersonalityAnalyzer analyzer = new PersonalityAnalyzer(textService);
        Map<String, SuspectActor> living = new LinkedHashMap<>();
        for (CaseCharacter character : caseModel.getCharacters()) {
            if (!character.isVictim()) {
                living.put(character.getName(),
                    new SuspectActor(character, PersonalityState.random(random), orchestrator, textService, analyzer));
            }
        }
        this.actors = Collections.unmodifiableMap(living);
        this.propagator = new GossipPropagator(actors, orchestrator, textService, memory, tasks);
        logger.info("🎮 [GameSession] Session {} started: {} suspects, victim {}", id, actors.size(), caseModel.getVictim());
    }

    /**
     * Generates hintable facts for every suspect in the background, each on its own lane
     */
    public CompletableFuture<Void> prefetchBriefings() {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (String name : actors.keySet()) {
            pending.add(tasks.onLane(name, "hintable facts", () -> orchestrator.generateHintableFacts(name)));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    /**
     * @throws IllegalArgumentException for a blank question, an unknown name or the victim
     * @throws IllegalStateException    when the suspect is still answering, or the session is closed
     */
    public InterrogationResult interrogate(String name, String question) {
        ensureOpen();
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        SuspectActor actor = getSuspect(name);
        InterrogationResult result = actor.respond(question.trim());
        investigationLog.recordExchange(actor.getName());
        if (!result.isFallback()) {
            if (gossipEnabled) {
                propagator.propagate(actor.getName(), result.getQuestion(), result.getAnswer());
            }
            scheduleSnippet(actor);
        }
        return result;
    }

    public String openingStatement(String name) {
        ensureOpen();
        SuspectActor actor = getSuspect(name);
        String statement = actor.getOpeningStatement();
        investigationLog.recordExchange(actor.getName());
        scheduleSnippet(actor);
        return statement;
    }

    private void scheduleSnippet(SuspectActor actor) {
        List<String> transcript = new ArrayList<>();
        actor.getCachedOpeningStatement().ifPresent(opening -> transcript.add(actor.getName() + ": " + opening));
        for (String line : actor.getConversation()) {
            transcript.add(line.startsWith("YOU: ") ? actor.getName() + ": " + line.substring(5) : line);
        }
        try {
            tasks.submit("snippet for " + actor.getName(),
                () -> investigationLog.addSnippet(actor.getName(), snippetWriter.write(actor.getName(), transcript)));
        } catch (IllegalStateException e) {
            logger.debug("[GameSession] Snippet for {} skipped: {}", actor.getName(), e.getMessage());
        }
    }

    /**
     * Looks a suspect up ignoring case
     *
     * @throws IllegalArgumentException for an unknown name or the victim
     */
    public SuspectActor getSuspect(String name) {
        String resolved = SuspectRoster.canonicalName(name);
        SuspectActor actor = resolved != null ? actors.get(resolved) : null;
        if (actor == null) {
            if (resolved != null && caseModel.hasCharacter(resolved) && caseModel.getCharacter(resolved).isVictim()) {
                throw new IllegalArgumentException(resolved + " is the victim and cannot be interviewed");
            }
            throw new IllegalArgumentException("Unknown suspect: " + name);
        }
        return actor;
    }

    public FactsSheet facts() {
        List<FactsSheet.ClueLine> clues = new ArrayList<>();
        for (Clue clue : caseModel.getClues()) {
            clues.add(new FactsSheet.ClueLine(clue.getText(), orchestrator.isRevealed(clue)));
        }
        return new FactsSheet(caseModel.getVictim(), caseModel.getCrimeLocation(), caseModel.getCauseOfDeath(),
            caseModel.getTimeOfDeath(), clues);
    }

    /**
     * Snippets grouped by character in order of first interview
     */
    public Map<String, List<String>> investigationLog() {
        return investigationLog.view();
    }

    public Optional<ContradictionAnalysis> contradictions(String name) {
        return orchestrator.getContradictionAnalysis(getSuspect(name).getName());
    }

    public List<CommunicationRecord> gossipLog() {
        return propagator.getCommunicationLog();
    }

    /**
     * @throws IllegalArgumentException for an unknown name or the victim
     */
    public AccusationResult accuse(String name) {
        CaseCharacter accused = getSuspect(name).getIdentity();
        boolean correct = accused.getName().equals(caseModel.getMurderer());
        List<String> hidden = orchestrator.getBriefing(accused.getName()).getWhatTheyHide();
        List<String> evidence = new ArrayList<>();
        if (correct) {
            evidence.addAll(hidden.subList(0, Math.min(MAX_KEY_EVIDENCE, hidden.size())));
            if (evidence.isEmpty()) {
                evidence.add("False alibi that couldn't hold under scrutiny");
                evidence.add("Suspicious behavior and nervousness");
                evidence.add("Motive connected to the victim");
            }
        } else {
            evidence.addAll(hidden.subList(0, Math.min(MAX_MISLEAD_REASONS, hidden.size())));
            if (evidence.isEmpty()) {
                evidence.add("Had conflicts with the victim");
                evidence.add("Nervous about unrelated secrets");
            }
        }
        logger.info("⚖️ [GameSession] {} accused {}: {}", id, accused.getName(), correct ? "correct" : "incorrect");
        return new AccusationResult(accused.getName(), correct, accused.describe(), caseModel.getMurderer(),
            caseModel.getMotive(), caseModel.getCauseOfDeath(), caseModel.getCrimeLocation(), caseModel.getTimeOfDeath(),
            evidence);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Game session " + id + " is closed");
        }
    }

    @Override
    public void close() {
        closed = true;
        tasks.close();
        logger.info("🛑 [GameSession] Session {} closed", id);
    }

    public boolean isClosed() {
        return closed;
    }

    public String getId() { return id; }
    public CaseModel getCaseModel() { return caseModel; }
    public NarrativeOrchestrator getOrchestrator() { return orchestrator; }
    public GossipPropagator getPropagator() { return propagator; }

    public Map<String, SuspectActor> getSuspects() {
        return actors;
    }
}
