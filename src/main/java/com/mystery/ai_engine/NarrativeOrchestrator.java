package com.mystery.ai_engine;

import com.mystery.analysis.ConsistencyChecker;
import com.mystery.analysis.Contradiction;
import com.mystery.analysis.ContradictionAnalysis;
import com.mystery.analysis.Statement;
import com.mystery.case_model.CaseCharacter;
import com.mystery.case_model.CaseModel;
import com.mystery.case_model.CharacterRole;
import com.mystery.case_model.Clue;
import com.mystery.case_model.ClueRelevance;
import com.mystery.case_model.RelationshipGraph;
import com.mystery.case_model.RelationshipType;
import com.mystery.game_state.InteractionRecord;
import com.mystery.messages.JsonResponseParser;
import com.mystery.prompts.OrchestratorPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps the story coherent across all suspects: derives briefings from the case, distributes clues,
 * tracks what each suspect said and which clues reached the detective, and runs contradiction analysis.
 */
public class NarrativeOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(NarrativeOrchestrator.class);

    static final double HINTABLE_FACTS_TEMPERATURE = 0.8;
    static final int HINTABLE_FACTS_MAX_TOKENS = 300;
    private static final int MAX_HINTABLE_FACTS = 3;

    private static final List<String> MURDERER_BEHAVIORS = List.of(
        "Will be defensive about their whereabouts",
        "May try to shift blame to others they don't like",
        "Will have inconsistencies if pressed hard",
        "May show nervousness when confronted with specific evidence",
        "Will protect their secret fiercely",
        "May contradict themselves under pressure"
    );

    private final CaseModel caseModel;
    private final RelationshipGraph graph;
    private final TextGenerationService textService;
    private final ConsistencyChecker consistencyChecker;

    private final Map<Clue, Set<String>> otherKnowers = new LinkedHashMap<>();
    private final Map<Clue, ClueRelevance> clueRelevance = new LinkedHashMap<>();

    private final Map<String, List<String>> hintableFacts = new ConcurrentHashMap<>();
    private final Map<String, List<InteractionRecord>> interrogationHistory = new ConcurrentHashMap<>();
    private final Map<String, List<Statement>> statements = new ConcurrentHashMap<>();
    private final Set<String> revealedClues = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Map<String, List<String>> gossipSummaries = new ConcurrentHashMap<>();

    public NarrativeOrchestrator(CaseModel caseModel, TextGenerationService textService,
                                 ConsistencyChecker consistencyChecker) {
        this.caseModel = caseModel;
        this.graph = caseModel.getRelationships();
        this.textService = textService;
        this.consistencyChecker = consistencyChecker;
        for (Clue clue : caseModel.getClues()) {
            otherKnowers.put(clue, Collections.unmodifiableSet(determineOtherKnowers(clue)));
            clueRelevance.put(clue, assessRelevance(clue));
        }
        logger.info("🧭 [Orchestrator] Narrative ready: {} clues distributed", otherKnowers.size());
    }

    // ---------------------------------------------------------------- clue distribution

    private Set<String> determineOtherKnowers(Clue clue) {
        Set<String> knowers = new LinkedHashSet<>();
        String owner = clue.getOwner();
        if (clue.mentions("romantic") || clue.mentions("love")) {
            knowers.addAll(graph.namesWith(owner, RelationshipType.ROMANTIC_PARTNER));
        }
        if ("relationship".equals(clue.getCategory())) {
            knowers.addAll(graph.namesWith(owner, RelationshipType.CLOSE_FRIEND));
        }
        knowers.add(caseModel.getMurderer());
        knowers.remove(owner);
        return knowers;
    }

    private ClueRelevance assessRelevance(Clue clue) {
        String text = clue.getText().toLowerCase(Locale.ROOT);
        if (text.contains(caseModel.getMurderer().toLowerCase(Locale.ROOT))
            || text.contains(caseModel.getVictim().toLowerCase(Locale.ROOT))) {
            return ClueRelevance.HIGH;
        }
        if (containsAny(text, "motive", "reason", "why", "because")) {
            return ClueRelevance.HIGH;
        }
        if (containsAny(text, "saw", "together", "alone", "time")) {
            return ClueRelevance.MEDIUM;
        }
        return ClueRelevance.LOW;
    }

    private static boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Everyone besides the owner who knows about the clue. Never contains the owner.
     */
    public Set<String> getOtherKnowers(Clue clue) {
        return otherKnowers.getOrDefault(clue, Collections.emptySet());
    }

    public ClueRelevance getRelevance(Clue clue) {
        return clueRelevance.getOrDefault(clue, ClueRelevance.LOW);
    }

    /**
     * Clues the character owns plus the ones they know about through someone else
     */
    public List<Clue> getKnownClues(String character) {
        List<Clue> known = new ArrayList<>();
        for (Clue clue : caseModel.getClues()) {
            if (clue.getOwner().equals(character) || getOtherKnowers(clue).contains(character)) {
                known.add(clue);
            }
        }
        return known;
    }

    // ---------------------------------------------------------------- briefing

    /**
     * Deterministic briefing for one character, with hintable facts when they have been generated
     */
    public Briefing getBriefing(String character) {
        CaseCharacter self = caseModel.getCharacter(character);
        return new Briefing(
            character,
            self.getRole(),
            whatTheyKnow(self),
            whatTheyHide(character),
            graph.relationsOf(character),
            likelyQuestions(),
            defensiveTopics(character),
            hintableFacts.getOrDefault(character, Collections.emptyList()));
    }

    private List<String> whatTheyKnow(CaseCharacter self) {
        List<String> knowledge = new ArrayList<>();
        knowledge.add("Their alibi: " + self.getAlibi());
        for (Clue clue : caseModel.cluesOwnedBy(self.getName())) {
            knowledge.add("Clue: " + clue.getText());
        }
        for (Map.Entry<String, RelationshipType> entry : graph.relationsOf(self.getName()).entrySet()) {
            if (entry.getValue().isIntimate()) {
                for (Clue clue : caseModel.cluesOwnedBy(entry.getKey())) {
                    knowledge.add("Might know through " + entry.getKey() + ": " + clue.getText());
                }
            }
        }
        return knowledge;
    }

    private List<String> whatTheyHide(String character) {
        List<String> secrets = new ArrayList<>();
        if (character.equals(caseModel.getMurderer())) {
            secrets.add("Their guilt in killing " + caseModel.getVictim());
            secrets.add("Their motive: " + caseModel.getMotive());
            for (Clue clue : caseModel.cluesOwnedBy(character)) {
                if (clue.isTruthful()) {
                    secrets.add("Evidence: " + clue.getText());
                }
            }
        }
        for (Clue clue : caseModel.cluesOwnedBy(character)) {
            if (!clue.isTruthful()) {
                secrets.add("False rumor: " + clue.getText());
            }
        }
        return secrets;
    }

    private List<String> likelyQuestions() {
        String victim = caseModel.getVictim();
        List<String> questions = new ArrayList<>();
        questions.add("Where were you when " + victim + " was killed?");
        questions.add("What's your relationship with " + victim + "?");
        questions.add("Did you see anyone suspicious?");
        questions.add("What do you know about " + victim + "?");
        if (caseModel.getMotive().toLowerCase(Locale.ROOT).contains("jealousy")
            && graph.hasAny(RelationshipType.ROMANTIC_PARTNER)) {
            questions.add("What's your relationship status?");
        }
        return questions;
    }

    private List<String> defensiveTopics(String character) {
        List<String> topics = new ArrayList<>();
        if (character.equals(caseModel.getMurderer())) {
            topics.add(caseModel.getVictim());
            topics.add("alibi");
            topics.add("whereabouts");
        }
        topics.addAll(getLikelyAccusations(character));
        return topics;
    }

    /**
     * What the character could be wrongly accused of
     */
    public List<String> getLikelyAccusations(String character) {
        List<String> accusations = new ArrayList<>();
        String victim = caseModel.getVictim();
        if (!character.equals(victim) && graph.between(character, victim).isHostile()) {
            accusations.add("Had conflict with " + victim);
        }
        for (Clue clue : caseModel.cluesOwnedBy(character)) {
            if (!clue.isTruthful()) {
                accusations.add("Spreading false rumors");
                break;
            }
        }
        return accusations;
    }

    /**
     * Asks the model for 2-3 things that might slip out of this character. Failure gives an empty list.
     * Successful results are cached and folded into later briefings.
     */
    public List<String> generateHintableFacts(String character) {
        List<String> cached = hintableFacts.get(character);
        if (cached != null) {
            return cached;
        }
        CaseCharacter self = caseModel.getCharacter(character);
        String prompt = OrchestratorPrompts.getHintableFactsPrompt(caseModel, self, graph.relationsOf(character),
            caseModel.cluesOwnedBy(character));
        try {
            String response = textService.generate(prompt, HINTABLE_FACTS_TEMPERATURE, HINTABLE_FACTS_MAX_TOKENS);
            List<String> facts = JsonResponseParser.parseStringArray(response);
            if (facts.size() > MAX_HINTABLE_FACTS) {
                facts = new ArrayList<>(facts.subList(0, MAX_HINTABLE_FACTS));
            }
            if (facts.isEmpty()) {
                logger.warn("⚠️ [Orchestrator] No hintable facts came back for {}", character);
                return Collections.emptyList();
            }
            List<String> stored = List.copyOf(facts);
            hintableFacts.put(character, stored);
            logger.info("💡 [Orchestrator] {} hintable facts ready for {}", stored.size(), character);
            return stored;
        } catch (GenerationException | IllegalArgumentException e) {
            logger.warn("⚠️ [Orchestrator] Hintable facts for {} failed: {}", character, e.getMessage());
            return Collections.emptyList();
        }
    }

    // ---------------------------------------------------------------- tracking

    /**
     * Records an answered question for the character and marks any clue the answer gives away
     */
    public InteractionRecord recordResponse(String character, String question, String response,
                                            Map<String, Integer> personalityAfter) {
        List<InteractionRecord> history = interrogationHistory.computeIfAbsent(character, name -> new CopyOnWriteArrayList<>());
        InteractionRecord record;
        synchronized (history) {
            record = new InteractionRecord(question, response, personalityAfter, history.size() + 1);
            history.add(record);
        }
        statements.computeIfAbsent(character, name -> new CopyOnWriteArrayList<>())
            .add(new Statement(response, question, record.getOrdinal()));

        for (Clue clue : ClueRevealDetector.revealedBy(response, caseModel.getClues())) {
            if (recordRevealedClue(clue.getText())) {
                logger.info("🔎 [Orchestrator] {} gave away a clue: {}", character, clue.getText());
            }
        }
        return record;
    }

    /**
     * @return true if the clue was not revealed before
     */
    public boolean recordRevealedClue(String clueText) {
        return revealedClues.add(clueText);
    }

    /**
     * Snapshot of revealed clue texts in the order they were revealed; the set only ever grows
     */
    public Set<String> getRevealedClues() {
        synchronized (revealedClues) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(revealedClues));
        }
    }

    public boolean isRevealed(Clue clue) {
        return revealedClues.contains(clue.getText());
    }

    public void recordGossipSummary(String character, String summary) {
        gossipSummaries.computeIfAbsent(character, name -> new CopyOnWriteArrayList<>()).add(summary);
        logger.info("📡 [Orchestrator] Recorded gossip summary for {}", character);
    }

    public List<String> getGossipSummaries(String character) {
        return List.copyOf(gossipSummaries.getOrDefault(character, Collections.emptyList()));
    }

    public List<InteractionRecord> getInterrogationHistory(String character) {
        return List.copyOf(interrogationHistory.getOrDefault(character, Collections.emptyList()));
    }

    public List<Statement> getStatements(String character) {
        return List.copyOf(statements.getOrDefault(character, Collections.emptyList()));
    }

    /**
     * Empty when the character has fewer than two statements or none of them contradict
     */
    public Optional<ContradictionAnalysis> getContradictionAnalysis(String character) {
        List<Statement> said = getStatements(character);
        if (said.size() < 2) {
            return Optional.empty();
        }
        List<Contradiction> found = consistencyChecker.findContradictions(said);
        return ContradictionAnalysis.of(character, said.size(), found);
    }

    // ---------------------------------------------------------------- narrative analysis

    /**
     * "high" for Rival/Enemy, "low" for Close Friend/Romantic Partner, "medium" otherwise
     */
    public String getTensionLevel(String a, String b) {
        RelationshipType type = graph.between(a, b);
        if (type.isHostile()) {
            return "high";
        }
        return type.isIntimate() ? "low" : "medium";
    }

    /**
     * How guilty an innocent may look: "High" for Rival/Enemy of the victim, "Medium" for an acquaintance
     */
    public String getFalseMotiveLevel(String character) {
        if (character.equals(caseModel.getVictim())) {
            return "Low";
        }
        RelationshipType type = graph.between(character, caseModel.getVictim());
        if (type.isHostile()) {
            return "High";
        }
        return type == RelationshipType.ACQUAINTANCE ? "Medium" : "Low";
    }

    public Map<String, Object> getMurdererProfile() {
        CaseCharacter murderer = caseModel.getCharacter(caseModel.getMurderer());
        List<String> evidence = new ArrayList<>();
        for (Clue clue : caseModel.getClues()) {
            if (clue.getOwner().equals(murderer.getName()) || clue.isTruthful()) {
                evidence.add(clue.getText());
            }
        }
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("name", murderer.getName());
        profile.put("age", murderer.getAge());
        profile.put("occupation", murderer.getOccupation());
        profile.put("motive", caseModel.getMotive());
        profile.put("likely_behaviors", MURDERER_BEHAVIORS);
        profile.put("evidence_they_know", evidence);
        return profile;
    }

    public Map<String, RelationshipType> getVictimConnections() {
        return graph.relationsOf(caseModel.getVictim());
    }

    /**
     * Tracking counters and derived narrative context, for diagnostics
     */
    public Map<String, Object> getStateSnapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("revealed_clues", new ArrayList<>(getRevealedClues()));
        state.put("suspect_statements", countsOf(statements));
        state.put("interrogation_count", countsOf(interrogationHistory));
        state.put("gossip_summaries", countsOf(gossipSummaries));
        state.put("murderer_profile", getMurdererProfile());

        Map<String, String> connections = new LinkedHashMap<>();
        for (Map.Entry<String, RelationshipType> entry : getVictimConnections().entrySet()) {
            connections.put(entry.getKey(), entry.getValue().getLabel());
        }
        state.put("victim_connections", connections);

        Map<String, Map<String, String>> web = new LinkedHashMap<>();
        for (Map.Entry<String, RelationshipType> entry : graph.asPairs().entrySet()) {
            String[] pair = entry.getKey().split("_");
            Map<String, String> edge = new LinkedHashMap<>();
            edge.put("type", entry.getValue().getLabel());
            edge.put("tension_level", getTensionLevel(pair[0], pair[1]));
            web.put(entry.getKey(), edge);
        }
        state.put("relationship_web", web);

        Map<String, Object> suspectMotives = new LinkedHashMap<>();
        for (CaseCharacter character : caseModel.getCharacters()) {
            if (character.getRole() == CharacterRole.INNOCENT) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("possible_involvement", getFalseMotiveLevel(character.getName()));
                entry.put("likely_accusations", getLikelyAccusations(character.getName()));
                suspectMotives.put(character.getName(), entry);
            }
        }
        state.put("suspect_motives", suspectMotives);

        Map<String, Object> distribution = new LinkedHashMap<>();
        for (Clue clue : caseModel.getClues()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("primary_knower", clue.getOwner());
            entry.put("other_knowers", new ArrayList<>(getOtherKnowers(clue)));
            entry.put("is_true", clue.isTruthful());
            entry.put("category", clue.getCategory());
            entry.put("relevance_to_solution", getRelevance(clue).getValue());
            distribution.put(clue.getText(), entry);
        }
        state.put("clue_distribution", distribution);
        return state;
    }

    private static Map<String, Integer> countsOf(Map<String, ? extends List<?>> tracked) {
        Map<String, Integer> counts = new HashMap<>();
        for (Map.Entry<String, ? extends List<?>> entry : tracked.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().size());
        }
        return counts;
    }

    public CaseModel getCaseModel() {
        return caseModel;
    }
}
