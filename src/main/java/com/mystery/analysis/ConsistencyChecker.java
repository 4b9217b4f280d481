package com.mystery.analysis;

import java.util.List;

/**
 * Strategy for spotting contradictions in one suspect's statements, oldest first
 */
public interface ConsistencyChecker {

    List<Contradiction> findContradictions(List<Statement> statements);
}
