package com.mystery.gossip;

import java.util.ArrayList;
import java.util.List;

/**
 * Progress and outcome of one gossip fan-out
 */
public class PropagationReport {
    private final String source;
    private final String question;
    private final List<PropagationStage> stages = new ArrayList<>();
    private final List<GossipRecipient> recipients = new ArrayList<>();
    private final List<CommunicationRecord> communications = new ArrayList<>();
    private final List<String> failures = new ArrayList<>();

    public PropagationReport(String source, String question) {
        this.source = source;
        this.question = question;
        stages.add(PropagationStage.IDLE);
    }

    synchronized void advance(PropagationStage stage) {
        if (getStage() != stage && !getStage().isTerminal()) {
            stages.add(stage);
        }
    }

    synchronized void setRecipients(List<GossipRecipient> selected) {
        recipients.clear();
        recipients.addAll(selected);
    }

    synchronized void addCommunication(CommunicationRecord record) {
        communications.add(record);
    }

    synchronized void addFailure(String note) {
        failures.add(note);
    }

    /**
     * Moves to COMPLETED, or FAILED when any recipient could not be reached
     */
    synchronized PropagationReport finish() {
        advance(failures.isEmpty() ? PropagationStage.COMPLETED : PropagationStage.FAILED);
        return this;
    }

    public String getSource() { return source; }
    public String getQuestion() { return question; }

    public synchronized PropagationStage getStage() {
        return stages.get(stages.size() - 1);
    }

    /**
     * Every stage entered, in order
     */
    public synchronized List<PropagationStage> getStages() {
        return List.copyOf(stages);
    }

    public synchronized List<GossipRecipient> getRecipients() {
        return List.copyOf(recipients);
    }

    public synchronized List<CommunicationRecord> getCommunications() {
        return List.copyOf(communications);
    }

    public synchronized List<String> getFailures() {
        return List.copyOf(failures);
    }
}
