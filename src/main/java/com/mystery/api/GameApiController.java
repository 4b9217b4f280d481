package com.mystery.api;

import com.mystery.ai_engine.InterrogationResult;
import com.mystery.ai_engine.SuspectActor;
import com.mystery.analysis.Contradiction;
import com.mystery.analysis.ContradictionAnalysis;
import com.mystery.case_model.CaseGenerationException;
import com.mystery.case_model.CaseModel;
import com.mystery.game_state.AccusationResult;
import com.mystery.game_state.FactsSheet;
import com.mystery.game_state.GameSession;
import com.mystery.gossip.CommunicationRecord;
import com.mystery.service.GameSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * REST controller for the mansion mystery.
 * Every operation except game creation is bound to a game_id.
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@Tag(name = "Game API", description = "Start games, interrogate suspects and make the accusation")
public class GameApiController {
    private static final Logger logger = LoggerFactory.getLogger(GameApiController.class);

    @Autowired
    private GameSessionService gameSessionService;

    /**
     * GET /api/health
     */
    @Operation(summary = "Server health", description = "Tells whether the server is up")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Server is up")
    })
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "ok");
        health.put("service", "Mansion Mystery");
        health.put("games", gameSessionService.getGameIds().size());
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }

    /**
     * POST /api/games - start a new game
     * Body (optional): {"sample": true} plays the stored sample case instead of drawing one
     */
    @Operation(summary = "Start a game", description = "Draws a case, or loads the sample case, and returns the game_id with the crime scene")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Game started"),
        @ApiResponse(responseCode = "502", description = "No valid case could be drawn"),
        @ApiResponse(responseCode = "500", description = "Game could not be started")
    })
    @PostMapping("/games")
    public ResponseEntity<Map<String, Object>> createGame(@RequestBody(required = false) Map<String, Object> body) {
        try {
            boolean sample = body != null && Boolean.TRUE.equals(body.get("sample"));
            GameSession session = gameSessionService.createGame(sample);
            CaseModel caseModel = session.getCaseModel();

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("game_id", session.getId());
            response.put("victim", caseModel.getVictim());
            response.put("crime_location", caseModel.getCrimeLocation());
            response.put("cause_of_death", caseModel.getCauseOfDeath());
            response.put("time_of_death", caseModel.getTimeOfDeath());
            response.put("suspects", new ArrayList<>(session.getSuspects().keySet()));
            return ResponseEntity.ok(response);
        } catch (CaseGenerationException e) {
            logger.warn("⚠️ [GameApi] Case generation failed: {}", e.getMessage());
            return error(HttpStatus.BAD_GATEWAY, e);
        } catch (Exception e) {
            logger.error("❌ [GameApi] Could not start a game: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * GET /api/games/{gameId}/suspects
     */
    @Operation(summary = "List the suspects", description = "Every living character with description, alibi and current personality levels")
    @GetMapping("/games/{gameId}/suspects")
    public ResponseEntity<Map<String, Object>> getSuspects(@PathVariable String gameId) {
        try {
            GameSession session = gameSessionService.getGame(gameId);
            List<Map<String, Object>> suspects = new ArrayList<>();
            for (SuspectActor actor : session.getSuspects().values()) {
                suspects.add(suspectToMap(actor));
            }
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("suspects", suspects);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * GET /api/games/{gameId}/suspects/{name}/opening - what the suspect says when called in
     */
    @Operation(summary = "Opening statement", description = "The suspect's first words when called in")
    @GetMapping("/games/{gameId}/suspects/{name}/opening")
    public ResponseEntity<Map<String, Object>> getOpeningStatement(@PathVariable String gameId, @PathVariable String name) {
        try {
            GameSession session = gameSessionService.getGame(gameId);
            String statement = session.openingStatement(name);
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("character", name);
            response.put("statement", statement);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (IllegalStateException e) {
            return error(HttpStatus.CONFLICT, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * POST /api/games/{gameId}/suspects/{name}/questions - ask one question
     * Body: {"question": "..."}
     */
    @Operation(summary = "Question a suspect", description = "Returns the answer, the personality changes it caused and the disclosure band used")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Suspect answered"),
        @ApiResponse(responseCode = "400", description = "Question missing"),
        @ApiResponse(responseCode = "404", description = "Unknown game or suspect"),
        @ApiResponse(responseCode = "409", description = "Suspect is still answering a previous question")
    })
    @PostMapping("/games/{gameId}/suspects/{name}/questions")
    public ResponseEntity<Map<String, Object>> askQuestion(@PathVariable String gameId, @PathVariable String name,
                                                           @RequestBody Map<String, Object> body) {
        try {
            if (body == null || !(body.get("question") instanceof String)
                    || ((String) body.get("question")).isBlank()) {
                Map<String, Object> error = new HashMap<>();
                error.put("success", false);
                error.put("error", "Field 'question' is required");
                return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
            }
            GameSession session = gameSessionService.getGame(gameId);
            InterrogationResult result = session.interrogate(name, (String) body.get("question"));

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("character", result.getCharacter());
            response.put("question", result.getQuestion());
            response.put("answer", result.getAnswer());
            response.put("trait_changes", result.getTraitDeltasByLabel());
            response.put("personality", result.getPersonalityAfter());
            response.put("disclosure", result.getDisclosure().name());
            response.put("fallback", result.isFallback());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (IllegalStateException e) {
            return error(HttpStatus.CONFLICT, e);
        } catch (Exception e) {
            logger.error("❌ [GameApi] Interrogation of {} failed: {}", name, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * GET /api/games/{gameId}/facts
     */
    @Operation(summary = "Case facts", description = "Victim, scene, cause and time of death, and the clues with their revealed flag")
    @GetMapping("/games/{gameId}/facts")
    public ResponseEntity<Map<String, Object>> getFacts(@PathVariable String gameId) {
        try {
            FactsSheet facts = gameSessionService.getGame(gameId).facts();
            List<Map<String, Object>> clues = new ArrayList<>();
            for (FactsSheet.ClueLine clue : facts.getClues()) {
                Map<String, Object> line = new HashMap<>();
                line.put("text", clue.getText());
                line.put("revealed", clue.isRevealed());
                clues.add(line);
            }
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("victim", facts.getVictim());
            response.put("crime_location", facts.getCrimeLocation());
            response.put("cause_of_death", facts.getCauseOfDeath());
            response.put("time_of_death", facts.getTimeOfDeath());
            response.put("clues", clues);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * GET /api/games/{gameId}/log - investigation notes grouped by suspect
     */
    @Operation(summary = "Investigation log", description = "Short observations per suspect, in order of first interview")
    @GetMapping("/games/{gameId}/log")
    public ResponseEntity<Map<String, Object>> getInvestigationLog(@PathVariable String gameId) {
        try {
            Map<String, List<String>> log = gameSessionService.getGame(gameId).investigationLog();
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("log", log);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * GET /api/games/{gameId}/suspects/{name}/contradictions
     */
    @Operation(summary = "Contradiction analysis", description = "Statements of one suspect that contradict earlier ones; empty until they have said two things")
    @GetMapping("/games/{gameId}/suspects/{name}/contradictions")
    public ResponseEntity<Map<String, Object>> getContradictions(@PathVariable String gameId, @PathVariable String name) {
        try {
            Optional<ContradictionAnalysis> analysis = gameSessionService.getGame(gameId).contradictions(name);
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("character", name);
            if (analysis.isPresent()) {
                List<Map<String, Object>> contradictions = new ArrayList<>();
                for (Contradiction contradiction : analysis.get().getContradictions()) {
                    Map<String, Object> entry = new HashMap<>();
                    entry.put("previous", contradiction.getPrevious());
                    entry.put("current", contradiction.getCurrent());
                    entry.put("context", contradiction.getContext());
                    contradictions.add(entry);
                }
                response.put("total_statements", analysis.get().getTotalStatements());
                response.put("contradictions", contradictions);
                response.put("consistency_score", analysis.get().getConsistencyScore());
            } else {
                response.put("contradictions", Collections.emptyList());
            }
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * GET /api/games/{gameId}/gossip - every relay that reached its listener
     */
    @Operation(summary = "Gossip log", description = "Who told whom what, with the listener's reaction")
    @GetMapping("/games/{gameId}/gossip")
    public ResponseEntity<Map<String, Object>> getGossipLog(@PathVariable String gameId) {
        try {
            GameSession session = gameSessionService.getGame(gameId);
            List<Map<String, Object>> communications = new ArrayList<>();
            for (CommunicationRecord record : session.gossipLog()) {
                Map<String, Object> entry = new HashMap<>();
                entry.put("from", record.getFrom());
                entry.put("to", record.getTo());
                entry.put("relationship", record.getRelationship().getLabel());
                entry.put("truthfulness", record.getTruthfulness());
                entry.put("relay", record.getRelayText());
                entry.put("reaction", record.getReactionText());
                communications.add(entry);
            }
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("communications", communications);
            response.put("failures", session.getPropagator().getFailureNotes());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * GET /api/games/{gameId}/state - the orchestrator's view of the case, spoilers included
     */
    @Operation(summary = "Narrative state", description = "Revealed clues, statement and interrogation counts, relationship web and murderer profile")
    @GetMapping("/games/{gameId}/state")
    public ResponseEntity<Map<String, Object>> getNarrativeState(@PathVariable String gameId) {
        try {
            Map<String, Object> state = gameSessionService.getGame(gameId).getOrchestrator().getStateSnapshot();
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("state", state);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * POST /api/games/{gameId}/accusation - name the murderer
     * Body: {"name": "..."}
     */
    @Operation(summary = "Accuse a suspect", description = "Returns the verdict and the solution of the case")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Verdict given"),
        @ApiResponse(responseCode = "400", description = "Name missing"),
        @ApiResponse(responseCode = "404", description = "Unknown game or suspect")
    })
    @PostMapping("/games/{gameId}/accusation")
    public ResponseEntity<Map<String, Object>> accuse(@PathVariable String gameId, @RequestBody Map<String, Object> body) {
        try {
            if (body == null || !(body.get("name") instanceof String)) {
                Map<String, Object> error = new HashMap<>();
                error.put("success", false);
                error.put("error", "Field 'name' is required");
                return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
            }
            AccusationResult result = gameSessionService.getGame(gameId).accuse((String) body.get("name"));

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("verdict", result.getVerdict());
            response.put("case_status", result.getCaseStatus());
            response.put("accused", result.getAccused());
            response.put("accused_description", result.getAccusedDescription());
            response.put("murderer", result.getRealMurderer());
            response.put("motive", result.getMotive());
            response.put("method", result.getMethod());
            response.put("location", result.getLocation());
            response.put("time", result.getTime());
            response.put(result.isCorrect() ? "key_evidence" : "misleading_reasons", result.getEvidence());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * DELETE /api/games/{gameId}
     */
    @Operation(summary = "End a game", description = "Stops the game's background work and forgets it")
    @DeleteMapping("/games/{gameId}")
    public ResponseEntity<Map<String, Object>> endGame(@PathVariable String gameId) {
        try {
            gameSessionService.endGame(gameId);
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("game_id", gameId);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    private Map<String, Object> suspectToMap(SuspectActor actor) {
        Map<String, Object> map = new HashMap<>();
        map.put("name", actor.getName());
        map.put("description", actor.getIdentity().describe());
        map.put("traits", actor.getIdentity().getFlavourTraits());
        map.put("alibi", actor.getIdentity().getAlibi());
        map.put("personality", actor.getPersonality().snapshot());
        map.put("busy", actor.isBusy());
        return map;
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, Exception e) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", e.getMessage());
        return ResponseEntity.status(status)
            .header("Content-Type", "application/json;charset=UTF-8")
            .body(error);
    }
}
