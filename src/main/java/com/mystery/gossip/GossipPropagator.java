package com.mystery.gossip;

import com.mystery.ai_engine.GenerationException;
import com.mystery.ai_engine.NarrativeOrchestrator;
import com.mystery.ai_engine.SuspectActor;
import com.mystery.ai_engine.TextGenerationService;
import com.mystery.case_model.RelationshipGraph;
import com.mystery.case_model.RelationshipType;
import com.mystery.game_state.BackgroundTasks;
import com.mystery.game_state.Trait;
import com.mystery.prompts.GossipPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * After an interrogation, lets the interrogated suspect tell the people close to them (or set against them)
 * about it. Runs in the background; every change to a listener happens on that listener's lane.
 */
public class GossipPropagator {
    private static final Logger logger = LoggerFactory.getLogger(GossipPropagator.class);

    static final double RELAY_TEMPERATURE = 0.8;
    static final int RELAY_MAX_TOKENS = 150;
    static final double REACTION_TEMPERATURE = 0.8;
    static final int REACTION_MAX_TOKENS = 150;

    private final Map<String, SuspectActor> actors;
    private final RelationshipGraph graph;
    private final NarrativeOrchestrator orchestrator;
    private final TextGenerationService textService;
    private final GossipMemoryService memory;
    private final BackgroundTasks tasks;

    private final List<CommunicationRecord> communicationLog = new CopyOnWriteArrayList<>();
    private final List<String> failureNotes = new CopyOnWriteArrayList<>();

    public GossipPropagator(Map<String, SuspectActor> actors, NarrativeOrchestrator orchestrator,
                            TextGenerationService textService, GossipMemoryService memory, BackgroundTasks tasks) {
        this.actors = actors;
        this.graph = orchestrator.getCaseModel().getRelationships();
        this.orchestrator = orchestrator;
        this.textService = textService;
        this.memory = memory;
        this.tasks = tasks;
    }

    /**
     * Every other living character whose relationship to the source says they get told, in roster order
     */
    public List<GossipRecipient> selectRecipients(String source) {
        List<GossipRecipient> recipients = new ArrayList<>();
        for (Map.Entry<String, RelationshipType> entry : graph.relationsOf(source).entrySet()) {
            if (!actors.containsKey(entry.getKey())) {
                continue;
            }
            GossipSharingTable.SharingRule rule = GossipSharingTable.ruleFor(entry.getValue());
            if (rule.shouldShare()) {
                recipients.add(new GossipRecipient(entry.getKey(), entry.getValue(), rule.getTruthfulness()));
            }
        }
        return recipients;
    }

    /**
     * Fans one answered question out to the selected recipients. Returns immediately; the future completes
     * once every listener's personality, gossip list and memory have been updated.
     */
    public CompletableFuture<PropagationReport> propagate(String source, String question, String answer) {
        PropagationReport report = new PropagationReport(source, question);
        SuspectActor speaker = actors.get(source);
        if (speaker == null) {
            report.addFailure("No suspect named " + source + " can gossip");
            return CompletableFuture.completedFuture(report.finish());
        }

        report.advance(PropagationStage.SELECTING_RECIPIENTS);
        List<GossipRecipient> recipients = selectRecipients(source);
        report.setRecipients(recipients);
        if (recipients.isEmpty()) {
            logger.debug("[GossipPropagator] Nobody hears about {}'s interrogation", source);
            return CompletableFuture.completedFuture(report.finish());
        }
        logger.info("🔄 [GossipPropagator] {} is telling {} about the interrogation", source, recipients);

        List<Exchange> exchanges = new ArrayList<>();
        for (GossipRecipient recipient : recipients) {
            exchanges.add(new Exchange(recipient));
        }
        CompletableFuture<Void> conversations;
        try {
            conversations = tasks.submit("gossip from " + source, () -> converse(report, speaker, question, answer, exchanges));
        } catch (IllegalStateException e) {
            note(report, "Gossip from " + source + " dropped: " + e.getMessage());
            return CompletableFuture.completedFuture(report.finish());
        }
        return conversations
            .thenCompose(ignored -> applyAll(report, source, exchanges))
            .thenApply(ignored -> report.finish());
    }

    private void converse(PropagationReport report, SuspectActor speaker, String question, String answer,
                          List<Exchange> exchanges) {
        report.advance(PropagationStage.RELAYING);
        Map<String, Integer> speakerLevels = speaker.getPersonality().snapshot();
        for (Exchange exchange : exchanges) {
            GossipRecipient recipient = exchange.recipient;
            try {
                exchange.relay = textService.generate(
                    GossipPrompts.getRelayPrompt(speaker.getName(), recipient.getName(),
                        recipient.getRelationship().getLabel(), question, answer, speakerLevels,
                        recipient.getTruthfulness()),
                    RELAY_TEMPERATURE, RELAY_MAX_TOKENS).trim();
            } catch (GenerationException e) {
                note(report, "Relay " + speaker.getName() + " -> " + recipient.getName() + " failed: " + e.getMessage());
            }
        }

        report.advance(PropagationStage.REACTING);
        for (Exchange exchange : exchanges) {
            if (exchange.relay == null) {
                continue;
            }
            GossipRecipient recipient = exchange.recipient;
            SuspectActor listener = actors.get(recipient.getName());
            try {
                exchange.reaction = textService.generate(
                    GossipPrompts.getReactionPrompt(recipient.getName(), speaker.getName(),
                        recipient.getRelationship().getLabel(), exchange.relay, listener.getPersonality().snapshot()),
                    REACTION_TEMPERATURE, REACTION_MAX_TOKENS).trim();
            } catch (GenerationException e) {
                note(report, "Reaction of " + recipient.getName() + " to " + speaker.getName() + " failed: " + e.getMessage());
            }
        }
    }

    private CompletableFuture<Void> applyAll(PropagationReport report, String source, List<Exchange> exchanges) {
        report.advance(PropagationStage.APPLYING_EFFECTS);
        List<CompletableFuture<Void>> updates = new ArrayList<>();
        for (Exchange exchange : exchanges) {
            if (exchange.relay == null || exchange.reaction == null) {
                continue;
            }
            String listener = exchange.recipient.getName();
            updates.add(tasks.onLane(listener, "gossip from " + source, () -> apply(report, source, exchange)));
        }
        return CompletableFuture.allOf(updates.toArray(new CompletableFuture[0]));
    }

    /**
     * Runs on the listener's lane
     */
    private void apply(PropagationReport report, String source, Exchange exchange) {
        GossipRecipient recipient = exchange.recipient;
        SuspectActor listener = actors.get(recipient.getName());

        for (Map.Entry<Trait, Double> effect : GossipSharingTable.effectsFor(recipient.getRelationship()).entrySet()) {
            listener.getPersonality().shift(effect.getKey(), effect.getValue());
        }
        List<GossipEntry> heard = listener.hearGossip(new GossipEntry(source, exchange.relay, recipient.getRelationship()));

        CommunicationRecord record = new CommunicationRecord(source, recipient.getName(), recipient.getRelationship(),
            recipient.getTruthfulness(), exchange.relay, exchange.reaction);
        communicationLog.add(record);
        report.addCommunication(record);
        logger.info("💬 [GossipPropagator] {} -> {}: \"{}\" / \"{}\"", source, recipient.getName(), exchange.relay, exchange.reaction);

        report.advance(PropagationStage.PERSISTING);
        try {
            memory.store(recipient.getName(), heard);
            memory.summarize(recipient.getName())
                .flatMap(MemorySummary::getSummaryText)
                .ifPresent(summary -> orchestrator.recordGossipSummary(recipient.getName(), summary));
        } catch (GossipMemoryException e) {
            note(report, "Gossip memory for " + recipient.getName() + " failed: " + e.getMessage());
        }
    }

    private void note(PropagationReport report, String failure) {
        logger.warn("⚠️ [GossipPropagator] {}", failure);
        failureNotes.add(failure);
        report.addFailure(failure);
    }

    /**
     * Every completed relay, oldest first
     */
    public List<CommunicationRecord> getCommunicationLog() {
        return List.copyOf(communicationLog);
    }

    public List<String> getFailureNotes() {
        return List.copyOf(failureNotes);
    }

    private static final class Exchange {
        private final GossipRecipient recipient;
        private volatile String relay;
        private volatile String reaction;

        private Exchange(GossipRecipient recipient) {
            this.recipient = recipient;
        }
    }
}
