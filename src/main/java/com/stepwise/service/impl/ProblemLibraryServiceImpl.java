package com.stepwise.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwise.model.ProblemModel;
import com.stepwise.model.ProblemType;
import com.stepwise.service.api.ProblemLibraryService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implementation of {@link ProblemLibraryService} backed by a JSON array on the classpath.
 * <p>
 * The library is read once at startup. A missing or unreadable resource is logged and leaves the
 * library empty so that the shell still starts; a problem whose identifier is already taken is
 * skipped with a warning.
 * </p>
 */
@Service
public class ProblemLibraryServiceImpl implements ProblemLibraryService {

    private static final Logger log = LoggerFactory.getLogger(ProblemLibraryServiceImpl.class);

    private final ObjectMapper objectMapper;
    private final String resourcePath;

    private Map<String, ProblemModel> problems = Map.of();

    public ProblemLibraryServiceImpl(ObjectMapper objectMapper,
                                     @Value("${stepwise.problems.resource:problems.json}") String resourcePath) {
        this.objectMapper = objectMapper;
        this.resourcePath = resourcePath;
    }

    /**
     * Reads the problem library from the configured classpath resource.
     */
    @PostConstruct
    public void loadProblems() {
        var resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            log.error("Problem library '{}' not found on the classpath", resourcePath);
            return;
        }

        try (InputStream in = resource.getInputStream()) {
            List<ProblemModel> loaded = objectMapper.readValue(in, new TypeReference<List<ProblemModel>>() {});
            Map<String, ProblemModel> byId = new LinkedHashMap<>();
            for (ProblemModel problem : loaded) {
                if (problem.problemId() == null || byId.putIfAbsent(problem.problemId(), problem) != null) {
                    log.warn("Skipping problem with missing or duplicate id '{}'", problem.problemId());
                }
            }
            this.problems = Collections.unmodifiableMap(byId);
            log.info("Loaded {} problems from {}", problems.size(), resourcePath);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load problem library '{}': {}", resourcePath, e.getMessage());
            this.problems = Map.of();
        }
    }

    @Override
    public List<ProblemModel> findAll() {
        return new ArrayList<>(problems.values());
    }

    @Override
    public Optional<ProblemModel> findById(String problemId) {
        if (problemId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(problems.get(problemId.trim()));
    }

    @Override
    public List<ProblemModel> findByType(ProblemType problemType) {
        return problems.values().stream()
                .filter(problem -> problem.problemType() == problemType)
                .toList();
    }
}
