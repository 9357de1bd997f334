package org.learningjava.assessrec.infrastructure.adapter.in.web.admin;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.learningjava.assessrec.application.usecase.EvaluateUseCase;
import org.learningjava.assessrec.domain.model.evaluation.EvaluationReport;
import org.learningjava.assessrec.domain.model.evaluation.Prediction;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class EvaluationControllerTest {

    @TempDir
    Path tmp;

    private EvaluateUseCase evaluate;
    private JobRegistry jobs;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        evaluate = mock(EvaluateUseCase.class);
        jobs = mock(JobRegistry.class);
        Executor executor = mock(Executor.class);

        doAnswer(inv -> { ((Runnable) inv.getArgument(0)).run(); return null; })
                .when(executor).execute(any(Runnable.class));

        mvc = MockMvcBuilders
                .standaloneSetup(new EvaluationController(evaluate, jobs, executor))
                .build();
    }

    @Test
    void run_evaluatesFile_andStoresReportOnJob() throws Exception {
        Path labeled = Files.writeString(tmp.resolve("train.csv"), "Query,Assessment_url\n");
        EvaluationReport report = new EvaluationReport(10, 4, 1, 0.25, 0.05, List.of());
        when(jobs.start("EVALUATION")).thenReturn("job-eval");
        when(evaluate.evaluate(labeled, 10)).thenReturn(report);

        mvc.perform(post("/evaluation/run").param("labeledSet", labeled.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId", is("job-eval")));

        verify(jobs).done(eq("job-eval"), contains("MR@10=0.2500"), same(report));
    }

    @Test
    void run_failure_marksJobFailed() throws Exception {
        Path labeled = Files.writeString(tmp.resolve("train.csv"), "Query,Assessment_url\n");
        when(jobs.start(anyString())).thenReturn("job-x");
        when(evaluate.evaluate(any(Path.class), anyInt())).thenThrow(new IllegalStateException("index missing"));

        mvc.perform(post("/evaluation/run").param("labeledSet", labeled.toString()).param("k", "5"))
                .andExpect(status().isOk());

        verify(jobs).fail("job-x", "index missing");
    }

    @Test
    void run_missingFile_is400_andStartsNoJob() throws Exception {
        mvc.perform(post("/evaluation/run").param("labeledSet", tmp.resolve("absent.csv").toString()))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(jobs, evaluate);
    }

    @Test
    void run_blankPath_is400() throws Exception {
        mvc.perform(post("/evaluation/run").param("labeledSet", " "))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(jobs);
    }

    @Test
    void predict_returnsRows() throws Exception {
        when(evaluate.predict(List.of("q1"), 3)).thenReturn(List.of(new Prediction("q1", "https://x/a/")));

        mvc.perform(post("/evaluation/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\":[\"q1\"],\"k\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].query", is("q1")))
                .andExpect(jsonPath("$[0].assessmentUrl", is("https://x/a/")));
    }

    @Test
    void predict_defaultsKToTen() throws Exception {
        when(evaluate.predict(anyList(), anyInt())).thenReturn(List.of());

        mvc.perform(post("/evaluation/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\":[\"q1\",\"q2\"]}"))
                .andExpect(status().isOk());

        verify(evaluate).predict(List.of("q1", "q2"), 10);
    }

    @Test
    void predict_invalidBody_is400() throws Exception {
        mvc.perform(post("/evaluation/predict").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\":[]}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/evaluation/predict").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\":[\"q\"],\"k\":0}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(evaluate);
    }
}
