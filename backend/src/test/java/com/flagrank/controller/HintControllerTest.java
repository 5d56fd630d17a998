package com.flagrank.controller;

import com.flagrank.dto.ScoringResponses;
import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.HintUnlockStatus;
import com.flagrank.repository.TeamRepository;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.HintUnlockService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HintController.class)
@Import({CapabilityGuard.class, FlagrankResponseMapper.class})
class HintControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HintUnlockService hintUnlockService;

    @MockitoBean
    private TeamRepository teamRepository;

    @Test
    void outOfOrderUnlockIsReportedWithoutBody() throws Exception {
        UUID teamId = UUID.randomUUID();
        UUID hintId = UUID.randomUUID();
        when(teamRepository.existsById(teamId)).thenReturn(true);
        when(hintUnlockService.unlock(teamId, "alice", hintId)).thenReturn(new ScoringResponses.HintUnlockResult(
                hintId, UUID.randomUUID(), teamId, 2, HintUnlockStatus.OUT_OF_ORDER, 0, null
        ));

        mockMvc.perform(post("/api/hints/{hintId}/unlock", hintId)
                        .header("X-Flagrank-Team", teamId.toString())
                        .header("X-Flagrank-Member", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OUT_OF_ORDER"))
                .andExpect(jsonPath("$.cost").value(0))
                .andExpect(jsonPath("$.body").doesNotExist());
    }

    @Test
    void unregisteredTeamCannotUnlock() throws Exception {
        UUID teamId = UUID.randomUUID();
        when(teamRepository.existsById(teamId)).thenReturn(false);

        mockMvc.perform(post("/api/hints/{hintId}/unlock", UUID.randomUUID())
                        .header("X-Flagrank-Team", teamId.toString()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("unknown_team"));

        verifyNoInteractions(hintUnlockService);
    }
}
