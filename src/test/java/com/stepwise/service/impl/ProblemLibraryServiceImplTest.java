package com.stepwise.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwise.model.Difficulty;
import com.stepwise.model.ProblemModel;
import com.stepwise.model.ProblemType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProblemLibraryServiceImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ProblemLibraryServiceImpl loadedFrom(String resource) {
        var service = new ProblemLibraryServiceImpl(objectMapper, resource);
        service.loadProblems();
        return service;
    }

    @Test
    @DisplayName("loadProblems should read the bundled library in file order")
    void testLoadBundledLibrary() {
        var service = loadedFrom("problems.json");

        assertThat(service.findAll()).hasSize(10);
        assertThat(service.findAll().get(0).problemId()).isEqualTo("solve-001");
        assertThat(service.findByType(ProblemType.SIMPLIFY_EXPRESSION)).hasSize(4);
        assertThat(service.findByType(ProblemType.SOLVE_EQUATION)).hasSize(6);
    }

    @Test
    @DisplayName("findById should trim the identifier and return the matching problem")
    void testFindById() {
        var service = loadedFrom("problems.json");

        assertThat(service.findById(" solve-003 "))
                .get()
                .satisfies(problem -> {
                    assertThat(problem.problemStatement()).isEqualTo("3x - 7 = 14");
                    assertThat(problem.finalStep()).isEqualTo("x = 7");
                });
        assertThat(service.findById("solve-999")).isEmpty();
        assertThat(service.findById(null)).isEmpty();
    }

    @Test
    @DisplayName("Bundled problems get a difficulty from the length of their solution")
    void testDifficulty() {
        var service = loadedFrom("problems.json");

        assertThat(service.findById("simplify-002").map(ProblemModel::difficulty)).contains(Difficulty.EASY);
        assertThat(service.findById("solve-006").map(ProblemModel::difficulty)).contains(Difficulty.MEDIUM);
        assertThat(service.findById("solve-001").map(ProblemModel::difficulty)).contains(Difficulty.HARD);
    }

    @Test
    @DisplayName("loadProblems should skip problems with a duplicate or missing id")
    void testDuplicateIds() {
        var service = loadedFrom("problems-duplicate.json");

        assertThat(service.findAll()).extracting(ProblemModel::problemId).containsExactly("dup-001", "dup-002");
        assertThat(service.findById("dup-001").map(ProblemModel::problemStatement)).contains("2x = 8");
    }

    @Test
    @DisplayName("Missing type and title are filled in from the statement and id")
    void testInferredFields() {
        var service = loadedFrom("problems-duplicate.json");

        assertThat(service.findById("dup-002")).get().satisfies(problem -> {
            assertThat(problem.problemType()).isEqualTo(ProblemType.SIMPLIFY_EXPRESSION);
            assertThat(problem.title()).isEqualTo("dup-002");
        });
    }

    @Test
    @DisplayName("loadProblems should leave the library empty when the resource is missing")
    void testMissingResource() {
        var service = loadedFrom("no-such-library.json");

        assertThat(service.findAll()).isEmpty();
        assertThat(service.findById("solve-001")).isEmpty();
    }

    @Test
    @DisplayName("loadProblems should leave the library empty when a problem is invalid")
    void testInvalidProblem() {
        var service = loadedFrom("problems-invalid.json");

        assertThat(service.findAll()).isEmpty();
    }
}
