package com.flagrank.controller;

import com.flagrank.dto.ScoringResponses;
import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.SubmissionStatus;
import com.flagrank.repository.TeamRepository;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.SubmissionService;
import com.flagrank.web.LedgerUnavailableException;
import com.flagrank.web.ScoringValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubmissionController.class)
@Import({CapabilityGuard.class, FlagrankResponseMapper.class})
class SubmissionControllerTest {

    private static final OffsetDateTime SUBMITTED_AT = OffsetDateTime.of(2026, 3, 14, 12, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SubmissionService submissionService;

    @MockitoBean
    private TeamRepository teamRepository;

    @Test
    void submitFlagReturnsAcceptedResult() throws Exception {
        UUID teamId = UUID.randomUUID();
        UUID challengeId = UUID.randomUUID();
        UUID submissionId = UUID.randomUUID();
        when(teamRepository.existsById(teamId)).thenReturn(true);
        when(submissionService.submit(teamId, "alice", challengeId, "flag{web}"))
                .thenReturn(new ScoringResponses.SubmissionResult(
                        submissionId, challengeId, teamId, SubmissionStatus.ACCEPTED, 100, SUBMITTED_AT
                ));

        mockMvc.perform(post("/api/challenges/{challengeId}/submissions", challengeId)
                        .header("X-Flagrank-Team", teamId.toString())
                        .header("X-Flagrank-Member", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flag\":\"flag{web}\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.awardedValue").value(100))
                .andExpect(jsonPath("$.submissionId").value(submissionId.toString()));
    }

    @Test
    void submitWithoutTeamHeaderIsForbidden() throws Exception {
        mockMvc.perform(post("/api/challenges/{challengeId}/submissions", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flag\":\"flag{web}\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("team_required"));

        verifyNoInteractions(submissionService);
    }

    @Test
    void judgeCannotSubmitFlags() throws Exception {
        mockMvc.perform(post("/api/challenges/{challengeId}/submissions", UUID.randomUUID())
                        .header("X-Flagrank-Team", UUID.randomUUID().toString())
                        .header("X-Flagrank-Role", "judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flag\":\"flag{web}\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("capability_denied"));
    }

    @Test
    void malformedTeamHeaderIsForbidden() throws Exception {
        mockMvc.perform(post("/api/challenges/{challengeId}/submissions", UUID.randomUUID())
                        .header("X-Flagrank-Team", "not-a-uuid")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flag\":\"flag{web}\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("invalid_team_header"));
    }

    @Test
    void missingFlagFieldFailsValidation() throws Exception {
        mockMvc.perform(post("/api/challenges/{challengeId}/submissions", UUID.randomUUID())
                        .header("X-Flagrank-Team", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"))
                .andExpect(jsonPath("$.fieldErrors.flag").value("flag is required"));
    }

    @Test
    void closedCompetitionMapsToBadRequest() throws Exception {
        UUID teamId = UUID.randomUUID();
        when(teamRepository.existsById(teamId)).thenReturn(true);
        when(submissionService.submit(any(), any(), any(), anyString()))
                .thenThrow(ScoringValidationException.competitionNotActive("Competition is finished"));

        mockMvc.perform(post("/api/challenges/{challengeId}/submissions", UUID.randomUUID())
                        .header("X-Flagrank-Team", teamId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flag\":\"flag{late}\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("competition_not_active"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void unavailableLedgerIsRetryable() throws Exception {
        UUID teamId = UUID.randomUUID();
        when(teamRepository.existsById(teamId)).thenReturn(true);
        when(submissionService.submit(any(), any(), any(), anyString()))
                .thenThrow(new LedgerUnavailableException("Flag submission", new QueryTimeoutException("timeout")));

        mockMvc.perform(post("/api/challenges/{challengeId}/submissions", UUID.randomUUID())
                        .header("X-Flagrank-Team", teamId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flag\":\"flag{web}\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("ledger_unavailable"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void challengeStatsAreVisibleToPlayers() throws Exception {
        UUID challengeId = UUID.randomUUID();
        when(submissionService.challengeStats(challengeId))
                .thenReturn(new ScoringResponses.ChallengeStats(challengeId, 4, 11, 350));

        mockMvc.perform(get("/api/challenges/{challengeId}/stats", challengeId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solveCount").value(4))
                .andExpect(jsonPath("$.nextSolveValue").value(350));

        verify(submissionService).challengeStats(challengeId);
    }
}
