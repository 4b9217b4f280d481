package com.mystery.gossip;

import com.mystery.ai_engine.NarrativeOrchestrator;
import com.mystery.ai_engine.PersonalityAnalyzer;
import com.mystery.ai_engine.ScriptedTextService;
import com.mystery.ai_engine.SuspectActor;
import com.mystery.analysis.NegationOverlapChecker;
import com.mystery.case_model.CaseFixtures;
import com.mystery.case_model.CaseModel;
import com.mystery.case_model.CharacterRole;
import com.mystery.case_model.RelationshipType;
import com.mystery.game_state.BackgroundTasks;
import com.mystery.game_state.PersonalityState;
import com.mystery.game_state.Trait;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class GossipPropagatorTest {

    private static final String QUESTION = "Did you see anyone near the cellar?";
    private static final String ANSWER = "I saw James with a wine bottle.";

    @Mock
    private GossipMemoryService failingMemory;

    private CaseModel caseModel;
    private ScriptedTextService text;
    private NarrativeOrchestrator orchestrator;
    private Map<String, SuspectActor> actors;

    @BeforeEach
    public void setUp() {
        caseModel = CaseFixtures.sampleCase();
        text = new ScriptedTextService();
        orchestrator = new NarrativeOrchestrator(caseModel, text, new NegationOverlapChecker());
        PersonalityAnalyzer analyzer = new PersonalityAnalyzer(text);
        actors = new LinkedHashMap<>();
        for (String name : caseModel.getLivingNames()) {
            actors.put(name, new SuspectActor(caseModel.getCharacter(name), new PersonalityState(3, 3, 3),
                orchestrator, text, analyzer));
        }
    }

    private GossipPropagator propagator(GossipMemoryService memory) {
        text.reply(ScriptedTextService.RELAY, "That detective thinks I'm hiding something.")
            .reply(ScriptedTextService.REACTION, "Serves you right.");
        return new GossipPropagator(actors, orchestrator, text, memory, new BackgroundTasks(Runnable::run));
    }

    @Test
    public void recipientsFollowTheSharingTableInRosterOrder() {
        List<GossipRecipient> recipients = propagator(new InMemoryGossipMemoryService("c")).selectRecipients("Lisa");

        assertEquals(2, recipients.size());
        assertEquals("Nick", recipients.get(0).getName());
        assertEquals(RelationshipType.ENEMY, recipients.get(0).getRelationship());
        assertEquals("James", recipients.get(1).getName());
        assertEquals(RelationshipType.CLOSE_FRIEND, recipients.get(1).getRelationship());
        assertEquals(CharacterRole.VICTIM, caseModel.getCharacter("Emma").getRole());
    }

    @Test
    public void enemyHearsALowTruthRelayAndGetsNervous() throws Exception {
        InMemoryGossipMemoryService memory = new InMemoryGossipMemoryService("mystery-test");

        PropagationReport report = propagator(memory).propagate("Lisa", QUESTION, ANSWER).get(5, TimeUnit.SECONDS);

        assertEquals(PropagationStage.COMPLETED, report.getStage());
        String relayToNick = text.promptsContaining("Now you're telling Nick").get(0);
        assertTrue(relayToNick.contains("Truthfulness level: 0.15"));
        assertTrue(relayToNick.contains(ANSWER));

        PersonalityState nick = actors.get("Nick").getPersonality();
        assertEquals(3.5, nick.getValue(Trait.ANXIETY), 1e-9);
        assertEquals(2.5, nick.getValue(Trait.TRUST), 1e-9);
        assertEquals(3.0, nick.getValue(Trait.MOODINESS), 1e-9);
        assertEquals(3.5, actors.get("James").getPersonality().getValue(Trait.TRUST), 1e-9);

        GossipEntry heard = actors.get("Nick").getHeardGossip().get(0);
        assertEquals("Lisa", heard.getSource());
        assertEquals("That detective thinks I'm hiding something.", heard.getText());
        assertTrue(memory.getStoredText("Nick").orElse("").contains("From Lisa (Enemy):"));
        assertEquals(1, orchestrator.getGossipSummaries("Nick").size());
        assertEquals(2, report.getCommunications().size());
        assertEquals("Serves you right.", report.getCommunications().get(0).getReactionText());
    }

    @Test
    public void stagesAreWalkedInOrder() throws Exception {
        PropagationReport report = propagator(new InMemoryGossipMemoryService("c"))
            .propagate("Lisa", QUESTION, ANSWER).get(5, TimeUnit.SECONDS);

        assertEquals(List.of(PropagationStage.IDLE, PropagationStage.SELECTING_RECIPIENTS, PropagationStage.RELAYING,
            PropagationStage.REACTING, PropagationStage.APPLYING_EFFECTS, PropagationStage.PERSISTING,
            PropagationStage.COMPLETED), report.getStages());
    }

    @Test
    public void nobodyToTellCompletesImmediately() throws Exception {
        // Sarah would tell Nick and David; Emma is dead
        actors.remove("Nick");
        actors.remove("David");

        PropagationReport report = propagator(new InMemoryGossipMemoryService("c"))
            .propagate("Sarah", QUESTION, ANSWER).get(5, TimeUnit.SECONDS);

        assertEquals(PropagationStage.COMPLETED, report.getStage());
        assertTrue(report.getRecipients().isEmpty());
        assertTrue(text.getPrompts().isEmpty());
    }

    @Test
    public void failedRelayLeavesThatListenerUntouched() throws Exception {
        text.fail("Now you're telling Nick");

        PropagationReport report = propagator(new InMemoryGossipMemoryService("c"))
            .propagate("Lisa", QUESTION, ANSWER).get(5, TimeUnit.SECONDS);

        assertEquals(PropagationStage.FAILED, report.getStage());
        assertEquals(1, report.getFailures().size());
        assertEquals(3.0, actors.get("Nick").getPersonality().getValue(Trait.ANXIETY), 1e-9);
        assertTrue(actors.get("Nick").getHeardGossip().isEmpty());
        assertEquals(1, actors.get("James").getHeardGossip().size());
    }

    @Test
    public void memoryFailureIsNotedButEffectsStay() throws Exception {
        when(failingMemory.store(any(), anyList())).thenThrow(new GossipMemoryException("store is down"));

        GossipPropagator propagator = propagator(failingMemory);
        PropagationReport report = propagator.propagate("Lisa", QUESTION, ANSWER).get(5, TimeUnit.SECONDS);

        assertEquals(PropagationStage.FAILED, report.getStage());
        assertEquals(2, report.getFailures().size());
        assertEquals(2, propagator.getCommunicationLog().size());
        assertEquals(3.5, actors.get("Nick").getPersonality().getValue(Trait.ANXIETY), 1e-9);
        verify(failingMemory).store(eq("Nick"), anyList());
        verify(failingMemory, never()).summarize(any());
        assertEquals(2, propagator.getFailureNotes().size());
    }
}
