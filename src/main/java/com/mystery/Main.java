package com.mystery;

import com.mystery.ai_engine.InterrogationResult;
import com.mystery.ai_engine.LocalLLMClient;
import com.mystery.ai_engine.SuspectActor;
import com.mystery.analysis.Contradiction;
import com.mystery.analysis.ContradictionAnalysis;
import com.mystery.analysis.NegationOverlapChecker;
import com.mystery.case_model.CaseGenerationException;
import com.mystery.case_model.CaseGenerator;
import com.mystery.case_model.CaseModel;
import com.mystery.game_state.AccusationResult;
import com.mystery.game_state.BackgroundTasks;
import com.mystery.game_state.FactsSheet;
import com.mystery.game_state.GameSession;
import com.mystery.gossip.CommunicationRecord;
import com.mystery.gossip.InMemoryGossipMemoryService;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Scanner;
import java.util.UUID;

/**
 * Console version of the mansion mystery.
 * Pass --sample to play the stored case instead of drawing a new one.
 */
public class Main {
    private static final String DEFAULT_MODEL = "mistral:7b";

    public static void main(String[] args) {
        boolean useSample = args.length > 0 && "--sample".equals(args[0]);
        String model = System.getenv("MYSTERY_MODEL");
        if (model == null || model.isEmpty()) {
            model = DEFAULT_MODEL;
        }

        System.out.println("=== Murder at the Mansion ===");
        System.out.println("Using local model " + model);
        System.out.println();

        LocalLLMClient client = new LocalLLMClient(new LocalLLMClient.LocalLLMConfig(model, 2000));
        client.checkAvailability();

        CaseModel caseModel;
        try {
            if (useSample) {
                caseModel = CaseGenerator.fromResource("cases/sample-case.json");
            } else {
                System.out.println("Drawing a new case...");
                caseModel = new CaseGenerator(client).generate();
            }
        } catch (CaseGenerationException e) {
            System.out.println("Could not set up the case: " + e.getMessage());
            System.out.println("Try again, or run with --sample.");
            return;
        }

        String sessionId = UUID.randomUUID().toString();
        try (GameSession session = new GameSession(sessionId, caseModel, client,
                new InMemoryGossipMemoryService("mystery-" + sessionId), new NegationOverlapChecker(),
                BackgroundTasks.withThreads(4), new Random(), true)) {
            session.prefetchBriefings();
            printScene(session);
            play(session, new Scanner(System.in));
        }
    }

    private static void play(GameSession session, Scanner scanner) {
        printHelp();
        while (true) {
            System.out.print("> ");
            if (!scanner.hasNextLine()) {
                return;
            }
            String line = scanner.nextLine().trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            String command = parts[0].toLowerCase();
            String argument = parts.length > 1 ? parts[1].trim() : "";
            try {
                switch (command) {
                    case "quit":
                    case "exit":
                        System.out.println("The case goes cold.");
                        return;
                    case "talk":
                        interview(session, session.getSuspect(argument), scanner);
                        break;
                    case "facts":
                        printFacts(session.facts());
                        break;
                    case "log":
                        printLog(session.investigationLog());
                        break;
                    case "gossip":
                        printGossip(session.gossipLog());
                        break;
                    case "check":
                        printContradictions(argument, session.contradictions(argument));
                        break;
                    case "accuse":
                        printVerdict(session.accuse(argument));
                        return;
                    default:
                        printHelp();
                }
            } catch (IllegalArgumentException | IllegalStateException e) {
                System.out.println(e.getMessage());
            }
        }
    }

    private static void interview(GameSession session, SuspectActor suspect, Scanner scanner) {
        System.out.println();
        System.out.println("--- " + suspect.getName() + ", " + suspect.getIdentity().describe() + " ---");
        System.out.println(suspect.getName() + ": " + session.openingStatement(suspect.getName()));
        System.out.println("(ask your questions, 'back' to leave)");
        while (true) {
            System.out.print("DETECTIVE> ");
            if (!scanner.hasNextLine()) {
                return;
            }
            String question = scanner.nextLine().trim();
            if (question.equalsIgnoreCase("back")) {
                System.out.println();
                return;
            }
            if (question.isEmpty()) {
                continue;
            }
            InterrogationResult result = session.interrogate(suspect.getName(), question);
            System.out.println(suspect.getName() + ": " + result.getAnswer());
            if (!result.getTraitDeltas().isEmpty()) {
                System.out.println("  (" + result.getTraitDeltasByLabel() + ")");
            }
        }
    }

    private static void printScene(GameSession session) {
        CaseModel caseModel = session.getCaseModel();
        System.out.println(caseModel.getVictim() + " was found dead in " + lower(caseModel.getCrimeLocation()) + ".");
        System.out.println("Cause of death: " + caseModel.getCauseOfDeath());
        System.out.println("Time of death: " + caseModel.getTimeOfDeath());
        System.out.println();
        System.out.println("Suspects:");
        for (SuspectActor suspect : session.getSuspects().values()) {
            System.out.println("  " + suspect.getName() + " - " + suspect.getIdentity().describe());
        }
        System.out.println();
    }

    private static void printHelp() {
        System.out.println("Commands: talk <name> | facts | log | gossip | check <name> | accuse <name> | quit");
    }

    private static void printFacts(FactsSheet facts) {
        System.out.println("Victim: " + facts.getVictim());
        System.out.println("Location: " + facts.getCrimeLocation());
        System.out.println("Cause: " + facts.getCauseOfDeath());
        System.out.println("Time: " + facts.getTimeOfDeath());
        for (FactsSheet.ClueLine clue : facts.getClues()) {
            System.out.println((clue.isRevealed() ? "  [revealed] " : "  ") + clue.getText());
        }
    }

    private static void printLog(Map<String, List<String>> log) {
        if (log.isEmpty()) {
            System.out.println("Nobody has been interviewed yet.");
        }
        for (Map.Entry<String, List<String>> entry : log.entrySet()) {
            System.out.println(entry.getKey() + ":");
            for (String snippet : entry.getValue()) {
                System.out.println("  - " + snippet);
            }
        }
    }

    private static void printGossip(List<CommunicationRecord> records) {
        if (records.isEmpty()) {
            System.out.println("No gossip has spread yet.");
        }
        for (CommunicationRecord record : records) {
            System.out.println(record.getFrom() + " -> " + record.getTo() + " (" + record.getRelationship().getLabel() + "): "
                + record.getRelayText());
            System.out.println("  " + record.getTo() + ": " + record.getReactionText());
        }
    }

    private static void printContradictions(String name, Optional<ContradictionAnalysis> analysis) {
        if (analysis.isEmpty()) {
            System.out.println("Not enough statements from " + name + " yet.");
            return;
        }
        System.out.printf("%d statements, consistency %.2f%n", analysis.get().getTotalStatements(),
            analysis.get().getConsistencyScore());
        for (Contradiction contradiction : analysis.get().getContradictions()) {
            System.out.println("  \"" + contradiction.getPrevious() + "\" vs \"" + contradiction.getCurrent() + "\"");
        }
    }

    private static void printVerdict(AccusationResult result) {
        System.out.println();
        if (result.isCorrect()) {
            System.out.println("🎉 Case solved! " + result.getAccused() + " (" + result.getAccusedDescription() + ") is the murderer.");
            System.out.println("Motive: " + result.getMotive());
            System.out.println("Method: " + result.getMethod());
            System.out.println("Where: " + result.getLocation() + ", " + lower(result.getTime()));
            System.out.println("Key evidence:");
        } else {
            System.out.println("❌ " + result.getAccused() + " is innocent. The murderer was " + result.getRealMurderer() + ".");
            System.out.println("Motive: " + result.getMotive());
            System.out.println(result.getAccused() + " looked suspicious because:");
        }
        for (String item : result.getEvidence()) {
            System.out.println("  - " + item);
        }
    }

    private static String lower(String text) {
        return text.isEmpty() ? text : Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }
}
