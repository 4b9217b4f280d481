package com.mystery.ai_engine;

import com.mystery.case_model.CaseCharacter;
import com.mystery.case_model.CaseModel;
import com.mystery.case_model.Clue;
import com.mystery.case_model.RelationshipType;
import com.mystery.game_state.PersonalityState;
import com.mystery.game_state.Trait;
import com.mystery.gossip.GossipEntry;
import com.mystery.prompts.SuspectPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One living suspect. Answers the detective in character, from a prompt rebuilt on every question
 * out of identity, personality, known clues, the orchestrator's briefing, heard gossip and the conversation so far.
 * Only one question per suspect can be outstanding at a time.
 */
public class SuspectActor {
    private static final Logger logger = LoggerFactory.getLogger(SuspectActor.class);

    static final double RESPONSE_TEMPERATURE = 0.9;
    static final int RESPONSE_MAX_TOKENS = 300;
    static final double OPENING_TEMPERATURE = 0.8;
    static final int OPENING_MAX_TOKENS = 100;
    static final int PROMPT_GOSSIP_ENTRIES = 3;
    static final String OPENING_FALLBACK = "I understand you wanted to talk to me about what happened.";

    private final CaseCharacter identity;
    private final CaseModel caseModel;
    private final Map<String, RelationshipType> relationships;
    private final List<Clue> knownClues;
    private final PersonalityState personality;
    private final NarrativeOrchestrator orchestrator;
    private final TextGenerationService textService;
    private final PersonalityAnalyzer analyzer;

    private final List<String> conversation = new CopyOnWriteArrayList<>();
    private final List<GossipEntry> heardGossip = new CopyOnWriteArrayList<>();
    private final ReentrantLock questionLock = new ReentrantLock();
    private volatile String openingStatement;

    public SuspectActor(CaseCharacter identity, PersonalityState personality, NarrativeOrchestrator orchestrator,
                        TextGenerationService textService, PersonalityAnalyzer analyzer) {
        if (identity.isVictim()) {
            throw new IllegalArgumentException(identity.getName() + " is the victim and cannot be interviewed");
        }
        this.identity = identity;
        this.caseModel = orchestrator.getCaseModel();
        this.relationships = caseModel.getRelationships().relationsOf(identity.getName());
        this.knownClues = List.copyOf(orchestrator.getKnownClues(identity.getName()));
        this.personality = personality;
        this.orchestrator = orchestrator;
        this.textService = textService;
        this.analyzer = analyzer;
    }

    /**
     * Answers one question. Never throws on service failure: the suspect then says a fixed line instead
     * and the personality is left alone.
     *
     * @throws IllegalStateException when a previous question to this suspect is still being answered
     */
    public InterrogationResult respond(String question) {
        if (!questionLock.tryLock()) {
            throw new IllegalStateException(identity.getName() + " is still answering the previous question");
        }
        try {
            String name = identity.getName();
            conversation.add("DETECTIVE: " + question);
            DisclosurePolicy disclosure = DisclosurePolicy.forTrust(personality.getLevel(Trait.TRUST));
            String prompt = buildPrompt(disclosure);

            String answer;
            try {
                answer = textService.generate(prompt, RESPONSE_TEMPERATURE, RESPONSE_MAX_TOKENS).trim();
            } catch (GenerationException e) {
                logger.warn("⚠️ [SuspectActor] {} could not answer, using the fallback line: {}", name, e.getMessage());
                String fallback = disclosure.getFallbackLine();
                conversation.add("YOU: " + fallback);
                return new InterrogationResult(name, question, fallback, Collections.emptyMap(), disclosure,
                    personality.snapshot(), true);
            }
            conversation.add("YOU: " + answer);

            Map<Trait, Integer> applied = personality.applyAnalysis(
                analyzer.analyze(identity, personality.snapshot(), question, answer));
            Map<String, Integer> after = personality.snapshot();
            orchestrator.recordResponse(name, question, answer, after);
            logger.info("🗣️ [SuspectActor] {} answered ({}), changes {}", name, disclosure, applied);
            return new InterrogationResult(name, question, answer, applied, disclosure, after, false);
        } finally {
            questionLock.unlock();
        }
    }

    String buildPrompt(DisclosurePolicy disclosure) {
        List<String> prior = new ArrayList<>(conversation);
        return SuspectPrompts.getSuspectPrompt(identity, caseModel.getVictim(), caseModel.getMotive(),
            personality.snapshot(), disclosure, knownClues, orchestrator.getBriefing(identity.getName()),
            relationships, getRecentGossip(), prior);
    }

    /**
     * First words when the detective calls the suspect in. Does not depend on the conversation;
     * cached after the first successful generation.
     */
    public String getOpeningStatement() {
        String cached = openingStatement;
        if (cached != null) {
            return cached;
        }
        try {
            String statement = textService.generate(
                SuspectPrompts.getOpeningStatementPrompt(identity, personality.snapshot()),
                OPENING_TEMPERATURE, OPENING_MAX_TOKENS).trim();
            if (statement.isEmpty()) {
                return OPENING_FALLBACK;
            }
            openingStatement = statement;
            return statement;
        } catch (GenerationException e) {
            logger.warn("⚠️ [SuspectActor] No opening statement for {}: {}", identity.getName(), e.getMessage());
            return OPENING_FALLBACK;
        }
    }

    public Optional<String> getCachedOpeningStatement() {
        return Optional.ofNullable(openingStatement);
    }

    /**
     * Adds a piece of gossip this suspect heard
     *
     * @return the whole list heard so far
     */
    public List<GossipEntry> hearGossip(GossipEntry entry) {
        heardGossip.add(entry);
        return getHeardGossip();
    }

    public List<GossipEntry> getHeardGossip() {
        return List.copyOf(heardGossip);
    }

    List<GossipEntry> getRecentGossip() {
        List<GossipEntry> all = getHeardGossip();
        return all.subList(Math.max(0, all.size() - PROMPT_GOSSIP_ENTRIES), all.size());
    }

    /**
     * Lines of the conversation, each prefixed with "DETECTIVE:" or "YOU:"
     */
    public List<String> getConversation() {
        return List.copyOf(conversation);
    }

    public boolean isBusy() {
        return questionLock.isLocked();
    }

    public String getName() {
        return identity.getName();
    }

    public CaseCharacter getIdentity() {
        return identity;
    }

    public PersonalityState getPersonality() {
        return personality;
    }

    public Map<String, RelationshipType> getRelationships() {
        return relationships;
    }

    public List<Clue> getKnownClues() {
        return knownClues;
    }
}
