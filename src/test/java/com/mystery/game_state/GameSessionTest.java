package com.mystery.game_state;

import com.mystery.ai_engine.InterrogationResult;
import com.mystery.ai_engine.ScriptedTextService;
import com.mystery.ai_engine.SuspectActor;
import com.mystery.analysis.NegationOverlapChecker;
import com.mystery.case_model.CaseFixtures;
import com.mystery.gossip.CommunicationRecord;
import com.mystery.gossip.InMemoryGossipMemoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class GameSessionTest {

    private static final String LISA_ANSWER = "Fine. I saw James carrying a wine bottle toward the cellar stairs.";

    private ScriptedTextService text;
    private GameSession session;

    @BeforeEach
    public void setUp() {
        text = new ScriptedTextService()
            .reply(ScriptedTextService.ANALYSIS, "{\"Anxious\": 1}")
            .reply(ScriptedTextService.SNIPPET, "\"Lisa watched James near the cellar\"")
            .reply(ScriptedTextService.OPENING, "I know why you're here, detective.")
            .reply(ScriptedTextService.RELAY, "The detective grilled me about James.")
            .reply(ScriptedTextService.REACTION, "Typical. Watch yourself.")
            .reply(ScriptedTextService.ANSWER, LISA_ANSWER);
        session = newSession(text, true);
    }

    private static GameSession newSession(ScriptedTextService text, boolean gossip) {
        return new GameSession("test-session", CaseFixtures.sampleCase(), text,
            new InMemoryGossipMemoryService("mystery-test"), new NegationOverlapChecker(),
            new BackgroundTasks(Runnable::run), new Random(7), gossip);
    }

    @Test
    public void onlyLivingCharactersAreSuspects() {
        assertEquals(List.of("Nick", "Sarah", "James", "David", "Lisa"), List.copyOf(session.getSuspects().keySet()));
        assertThrows(IllegalArgumentException.class, () -> session.getSuspect("Emma"));
        assertThrows(IllegalArgumentException.class, () -> session.getSuspect("The Butler"));
        assertEquals("Lisa", session.getSuspect("lisa").getName());
    }

    @Test
    public void answerIsRecordedLoggedAndRevealsTheClue() {
        InterrogationResult result = session.interrogate("Lisa", "Did you see anyone near the cellar?");

        assertEquals(LISA_ANSWER, result.getAnswer());
        assertFalse(result.isFallback());
        assertEquals(Integer.valueOf(1), result.getTraitDeltasByLabel().get("Anxious"));
        assertEquals(List.of("Lisa watched James near the cellar"), session.investigationLog().get("Lisa"));

        FactsSheet facts = session.facts();
        assertEquals("Emma", facts.getVictim());
        assertEquals("The wine cellar", facts.getCrimeLocation());
        long revealed = facts.getClues().stream().filter(FactsSheet.ClueLine::isRevealed).count();
        assertEquals(1, revealed);
        assertEquals(1, session.getOrchestrator().getInterrogationHistory("Lisa").size());
    }

    @Test
    public void revealedCluesStayRevealed() {
        session.interrogate("Lisa", "Did you see anyone near the cellar?");
        text.reply(ScriptedTextService.ANSWER, "I have nothing more to say.");
        session.interrogate("Lisa", "Anything else?");

        assertEquals(1, session.getOrchestrator().getRevealedClues().size());
        assertTrue(session.getOrchestrator().getRevealedClues().iterator().next().startsWith("Lisa saw James"));
    }

    @Test
    public void answerSpreadsAsGossipToFriendAndEnemy() {
        session.interrogate("Lisa", "Did you see anyone near the cellar?");

        List<CommunicationRecord> log = session.gossipLog();
        assertEquals(2, log.size());
        assertEquals("Nick", log.get(0).getTo());
        assertEquals(0.15, log.get(0).getTruthfulness(), 1e-9);
        assertEquals("James", log.get(1).getTo());
        assertEquals(1, session.getSuspect("Nick").getHeardGossip().size());
        assertEquals(1, session.getOrchestrator().getGossipSummaries("James").size());
        assertTrue(session.getSuspect("Sarah").getHeardGossip().isEmpty());
    }

    @Test
    public void gossipCanBeSwitchedOff() {
        GameSession quiet = newSession(text, false);

        quiet.interrogate("Lisa", "Did you see anyone near the cellar?");

        assertTrue(quiet.gossipLog().isEmpty());
        assertTrue(text.promptsContaining(ScriptedTextService.RELAY).isEmpty());
    }

    @Test
    public void failedAnswerUsesFallbackLineAndSkipsFollowUps() {
        ScriptedTextService failing = new ScriptedTextService().fail(ScriptedTextService.ANSWER);
        GameSession broken = newSession(failing, true);
        SuspectActor nick = broken.getSuspect("Nick");
        Map<String, Integer> before = nick.getPersonality().snapshot();

        InterrogationResult result = broken.interrogate("Nick", "Where were you?");

        assertTrue(result.isFallback());
        assertEquals(result.getDisclosure().getFallbackLine(), result.getAnswer());
        assertEquals(before, nick.getPersonality().snapshot());
        assertEquals(List.of(InvestigationLog.PENDING), broken.investigationLog().get("Nick"));
        assertTrue(broken.gossipLog().isEmpty());
        assertTrue(failing.promptsContaining(ScriptedTextService.ANALYSIS).isEmpty());
    }

    @Test
    public void openingStatementIsLoggedAndCached() {
        assertEquals("I know why you're here, detective.", session.openingStatement("Sarah"));
        assertEquals("I know why you're here, detective.", session.openingStatement("Sarah"));

        assertEquals(1, text.promptsContaining(ScriptedTextService.OPENING).size());
        assertTrue(session.investigationLog().containsKey("Sarah"));
    }

    @Test
    public void blankQuestionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> session.interrogate("Lisa", "   "));
    }

    @Test
    public void correctAccusationRevealsTheSolution() {
        AccusationResult result = session.accuse("James");

        assertTrue(result.isCorrect());
        assertEquals("correct", result.getVerdict());
        assertEquals("James", result.getRealMurderer());
        assertEquals("Jealousy over a romantic relationship", result.getMotive());
        assertEquals("Poisoning (antifreeze in their wine glass)", result.getMethod());
        assertEquals("Their guilt in killing Emma", result.getEvidence().get(0));
        assertTrue(result.getEvidence().size() <= 3);
        assertEquals("35 year old Male Chef", result.getAccusedDescription());
    }

    @Test
    public void wrongAccusationNamesTheRealMurdererWhoeverWasAccused() {
        AccusationResult nick = session.accuse("Nick");
        AccusationResult david = session.accuse("David");

        assertFalse(nick.isCorrect());
        assertEquals("incorrect", nick.getVerdict());
        assertEquals("James", nick.getRealMurderer());
        assertEquals(nick.getRealMurderer(), david.getRealMurderer());
        assertEquals(nick.getMotive(), david.getMotive());
        assertEquals(List.of("Had conflicts with the victim", "Nervous about unrelated secrets"), nick.getEvidence());
        assertEquals(1, david.getEvidence().size());
        assertTrue(david.getEvidence().get(0).startsWith("False rumor"));
    }

    @Test
    public void accusingTheVictimIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> session.accuse("Emma"));
    }

    @Test
    public void closedSessionRefusesQuestions() {
        session.close();

        assertTrue(session.isClosed());
        assertThrows(IllegalStateException.class, () -> session.interrogate("Lisa", "Still there?"));
    }
}
