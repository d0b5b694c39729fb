package com.stepwise.service.api;

import com.stepwise.model.ProblemModel;
import com.stepwise.model.ProblemType;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the curated problems bundled with the application.
 */
public interface ProblemLibraryService {

    /**
     * @return Every problem, in library order.
     */
    List<ProblemModel> findAll();

    /**
     * @param problemId The identifier, e.g. {@code solve-001}.
     * @return The problem, or empty if no problem has that identifier.
     */
    Optional<ProblemModel> findById(String problemId);

    /**
     * @param problemType The type to filter by.
     * @return The problems of that type, in library order.
     */
    List<ProblemModel> findByType(ProblemType problemType);
}
