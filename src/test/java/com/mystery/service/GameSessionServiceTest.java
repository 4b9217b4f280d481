package com.mystery.service;

import com.mystery.ai_engine.GenerationException;
import com.mystery.ai_engine.TextGenerationService;
import com.mystery.analysis.ConsistencyChecker;
import com.mystery.analysis.NegationOverlapChecker;
import com.mystery.game_state.GameSession;
import com.mystery.gossip.GossipMemoryProvider;
import com.mystery.gossip.InMemoryGossipMemoryService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class GameSessionServiceTest {

    @Mock
    private TextGenerationService textGenerationService;

    @Mock
    private GossipMemoryProvider gossipMemoryProvider;

    @Spy
    private ConsistencyChecker consistencyChecker = new NegationOverlapChecker();

    @InjectMocks
    private GameSessionService gameSessionService;

    @BeforeEach
    public void setUp() {
        lenient().when(textGenerationService.generate(anyString(), anyDouble(), anyInt()))
            .thenThrow(new GenerationException("model offline"));
        lenient().when(gossipMemoryProvider.open(anyString()))
            .thenAnswer(invocation -> new InMemoryGossipMemoryService(invocation.getArgument(0)));
    }

    @AfterEach
    public void tearDown() {
        gameSessionService.shutdown();
    }

    @Test
    public void sampleGameIsRegisteredWithItsOwnMemory() {
        GameSession session = gameSessionService.createGame(true);

        assertEquals("Emma", session.getCaseModel().getVictim());
        assertSame(session, gameSessionService.getGame(session.getId()));
        assertEquals(List.of(session.getId()), gameSessionService.getGameIds());
        verify(gossipMemoryProvider).open("mystery-" + session.getId());
    }

    @Test
    public void eachGameGetsItsOwnSession() {
        GameSession first = gameSessionService.createGame(true);
        GameSession second = gameSessionService.createGame(true);

        assertNotEquals(first.getId(), second.getId());
        assertNotSame(first.getSuspect("Lisa"), second.getSuspect("Lisa"));
        assertEquals(2, gameSessionService.getGameIds().size());
    }

    @Test
    public void endedGameIsClosedAndForgotten() {
        GameSession session = gameSessionService.createGame(true);

        gameSessionService.endGame(session.getId());

        assertTrue(session.isClosed());
        assertThrows(IllegalArgumentException.class, () -> gameSessionService.getGame(session.getId()));
        assertThrows(IllegalArgumentException.class, () -> gameSessionService.endGame(session.getId()));
    }

    @Test
    public void unknownGameIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> gameSessionService.getGame("missing"));
        assertEquals("Game not found: missing", e.getMessage());
    }

    @Test
    public void shutdownClosesEverySession() {
        GameSession first = gameSessionService.createGame(true);
        GameSession second = gameSessionService.createGame(true);

        gameSessionService.shutdown();

        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
        assertTrue(gameSessionService.getGameIds().isEmpty());
    }
}
