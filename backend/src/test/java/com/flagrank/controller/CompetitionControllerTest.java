package com.flagrank.controller;

import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.CompetitionSettings;
import com.flagrank.repository.TeamRepository;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.CompetitionClock;
import com.flagrank.service.CompetitionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompetitionController.class)
@Import({CapabilityGuard.class, FlagrankResponseMapper.class})
class CompetitionControllerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 14, 12, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CompetitionService competitionService;

    @MockitoBean
    private CompetitionClock competitionClock;

    @MockitoBean
    private TeamRepository teamRepository;

    @BeforeEach
    void setUp() {
        when(competitionClock.now()).thenReturn(NOW);
    }

    @Test
    void anyoneCanReadCompetitionPhase() throws Exception {
        when(competitionService.settings()).thenReturn(settings(NOW.minusHours(1), NOW.plusHours(1), NOW.minusMinutes(5)));

        mockMvc.perform(get("/api/competition"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("ACTIVE"))
                .andExpect(jsonPath("$.frozen").value(true));
    }

    @Test
    void updateWindowRejectsStartAfterEnd() throws Exception {
        mockMvc.perform(put("/api/admin/competition")
                        .header("X-Flagrank-Role", "superadmin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startTime\":\"2026-03-15T10:00:00Z\",\"endTime\":\"2026-03-15T09:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"));

        verify(competitionService, never()).updateWindow(any(), any(), any());
    }

    @Test
    void editorCannotCloseCompetition() throws Exception {
        mockMvc.perform(post("/api/admin/competition/close").header("X-Flagrank-Role", "editor"))
                .andExpect(status().isForbidden());

        verify(competitionService, never()).close();
    }

    @Test
    void superadminClosesCompetition() throws Exception {
        CompetitionSettings closed = settings(NOW.minusHours(2), NOW.plusHours(1), null);
        closed.setClosedAt(NOW);
        when(competitionService.close()).thenReturn(closed);

        mockMvc.perform(post("/api/admin/competition/close").header("X-Flagrank-Role", "SUPERADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("FINISHED"));
    }

    private static CompetitionSettings settings(OffsetDateTime start, OffsetDateTime end, OffsetDateTime freeze) {
        CompetitionSettings settings = new CompetitionSettings();
        settings.setName("Test CTF");
        settings.setStartTime(start);
        settings.setEndTime(end);
        settings.setFreezeTime(freeze);
        settings.setCreatedAt(NOW.minusDays(1));
        settings.setUpdatedAt(NOW.minusDays(1));
        return settings;
    }
}
