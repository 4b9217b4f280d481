package com.mystery.service;

import com.mystery.ai_engine.TextGenerationService;
import com.mystery.analysis.ConsistencyChecker;
import com.mystery.case_model.CaseGenerator;
import com.mystery.case_model.CaseModel;
import com.mystery.game_state.BackgroundTasks;
import com.mystery.game_state.GameSession;
import com.mystery.gossip.GossipMemoryProvider;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the running game sessions of this server
 */
@Service
public class GameSessionService {
    private static final Logger logger = LoggerFactory.getLogger(GameSessionService.class);
    public static final String SAMPLE_CASE = "cases/sample-case.json";

    @Autowired
    private TextGenerationService textGenerationService;

    @Autowired
    private GossipMemoryProvider gossipMemoryProvider;

    @Autowired
    private ConsistencyChecker consistencyChecker;

    @Value("${mystery.gossip.enabled:true}")
    private boolean gossipEnabled = true;

    @Value("${mystery.background.threads:4}")
    private int backgroundThreads = 4;

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    /**
     * Starts a game on a freshly drawn case, or on the stored sample case
     *
     * @throws com.mystery.case_model.CaseGenerationException when no valid case could be drawn
     */
    public GameSession createGame(boolean useSampleCase) {
        CaseModel caseModel = useSampleCase
            ? CaseGenerator.fromResource(SAMPLE_CASE)
            : new CaseGenerator(textGenerationService).generate();
        return startSession(caseModel);
    }

    GameSession startSession(CaseModel caseModel) {
        String id = UUID.randomUUID().toString();
        GameSession session = new GameSession(id, caseModel, textGenerationService,
            gossipMemoryProvider.open("mystery-" + id), consistencyChecker,
            BackgroundTasks.withThreads(backgroundThreads), new Random(), gossipEnabled);
        sessions.put(id, session);
        session.prefetchBriefings();
        logger.info("✅ [GameSessionService] Game {} created ({} running)", id, sessions.size());
        return session;
    }

    /**
     * @throws IllegalArgumentException when no such game is running
     */
    public GameSession getGame(String gameId) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            throw new IllegalArgumentException("Game not found: " + gameId);
        }
        return session;
    }

    /**
     * @throws IllegalArgumentException when no such game is running
     */
    public void endGame(String gameId) {
        GameSession session = sessions.remove(gameId);
        if (session == null) {
            throw new IllegalArgumentException("Game not found: " + gameId);
        }
        session.close();
    }

    public List<String> getGameIds() {
        return new ArrayList<>(sessions.keySet());
    }

    @PreDestroy
    public void shutdown() {
        for (String id : getGameIds()) {
            GameSession session = sessions.remove(id);
            if (session != null) {
                session.close();
            }
        }
    }
}
