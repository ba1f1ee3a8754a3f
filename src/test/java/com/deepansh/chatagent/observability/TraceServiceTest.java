package com.deepansh.chatagent.observability;

import com.deepansh.chatagent.core.Session;
import com.deepansh.chatagent.model.TerminationOutcome;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TraceServiceTest {

    @Mock AgentRunTraceRepository traceRepository;

    @InjectMocks
    TraceService traceService;

    @Test
    void persistTrace_copiesSessionAndRunContext() {
        Session session = Session.builder()
                .sessionId("s1").chatId("c1").query("what is up").personaId("chef")
                .initialUsage(Map.of("web_search", 2))
                .build();
        session.getRunContext().recordReasoningCall(120, 30);
        session.getRunContext().recordToolCall("web_search", 15, true, "results");

        traceService.persistTrace(session);

        ArgumentCaptor<AgentRunTrace> captor = ArgumentCaptor.forClass(AgentRunTrace.class);
        verify(traceRepository).save(captor.capture());
        AgentRunTrace trace = captor.getValue();
        assertThat(trace.getSessionId()).isEqualTo("s1");
        assertThat(trace.getChatId()).isEqualTo("c1");
        assertThat(trace.getPersonaId()).isEqualTo("chef");
        assertThat(trace.getOutcome()).isEqualTo(TerminationOutcome.Kind.PENDING);
        assertThat(trace.getToolUsage()).containsEntry("web_search", 2);
        assertThat(trace.getToolCalls()).extracting(RunContext.ToolCallRecord::toolName).containsExactly("web_search");
        assertThat(trace.getPromptTokens()).isEqualTo(120);
        assertThat(trace.getCompletionTokens()).isEqualTo(30);
        assertThat(trace.getReasoningCalls()).isEqualTo(1);
    }

    @Test
    void persistTrace_repositoryFails_doesNotThrow() {
        when(traceRepository.save(any())).thenThrow(new RuntimeException("mongo down"));
        Session session = Session.builder().sessionId("s1").chatId("c1").query("q").build();

        assertThatCode(() -> traceService.persistTrace(session)).doesNotThrowAnyException();
    }

    @Test
    void getAnalytics_roundsLatencyAndGroupsOutcomes() {
        when(traceRepository.avgLatencyForChat("c1")).thenReturn(1234.6);
        when(traceRepository.outcomeBreakdownForChat("c1")).thenReturn(List.of(
                new AgentRunTraceRepository.OutcomeCount("FINAL_CONTENT", 3),
                new AgentRunTraceRepository.OutcomeCount("CANCELLED", 1)));

        Map<String, Object> analytics = traceService.getAnalytics("c1");

        assertThat(analytics).containsEntry("avgLatencyMs", 1235L);
        assertThat(analytics.get("outcomeBreakdown"))
                .asInstanceOf(InstanceOfAssertFactories.map(String.class, Long.class))
                .containsEntry("FINAL_CONTENT", 3L)
                .containsEntry("CANCELLED", 1L);
    }
}
