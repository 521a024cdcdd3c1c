package com.advisor.chase.service;

import com.advisor.chase.model.*;
import com.advisor.chase.registry.ChaseItemRegistry;
import com.advisor.chase.registry.CommitResult;
import com.advisor.chase.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChaseItemServiceTest {

    @Mock private ChaseItemRegistry registry;
    @Mock private ProviderProfileService profileService;

    private ChaseItemService service;

    @BeforeEach
    void setUp() {
        service = new ChaseItemService(registry, profileService);
    }

    @Test
    void create_document_defaultsKindClientAndPriority() {
        when(registry.register(any())).thenAnswer(inv -> inv.getArgument(0));
        CreateChaseRequest request = CreateChaseRequest.builder()
                .type(ChaseType.DOCUMENT)
                .target(ChaseTarget.builder().id("CLIENT-007").build())
                .build();

        service.create(request);

        ArgumentCaptor<ChaseItem> captor = ArgumentCaptor.forClass(ChaseItem.class);
        verify(registry).register(captor.capture());
        ChaseItem draft = captor.getValue();
        assertThat(draft.getTarget().getKind()).isEqualTo(TargetKind.CLIENT);
        assertThat(draft.getTarget().getName()).isEqualTo("CLIENT-007");
        assertThat(draft.getClientId()).isEqualTo("CLIENT-007");
        assertThat(draft.getPriority()).isEqualTo(Priority.MEDIUM);
        assertThat(draft.getStatus()).isEqualTo(ChaseStatus.CREATED);
    }

    @Test
    void create_loa_targetsProvider() {
        when(registry.register(any())).thenAnswer(inv -> inv.getArgument(0));

        ChaseItem draft = service.create(TestDataFactory.loaRequest("Aviva", Priority.HIGH));

        assertThat(draft.getTarget().getKind()).isEqualTo(TargetKind.PROVIDER);
        assertThat(draft.getProviderRef()).isEqualTo("Aviva");
        assertThat(draft.getClientId()).isEqualTo("CLIENT-001");
        assertThat(draft.getPriority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void create_invalidRequests_throw() {
        CreateChaseRequest noType = CreateChaseRequest.builder()
                .target(ChaseTarget.builder().id("CLIENT-001").build()).build();
        CreateChaseRequest noTarget = CreateChaseRequest.builder().type(ChaseType.DOCUMENT).build();
        CreateChaseRequest loaWithoutProvider = TestDataFactory.loaRequest("Aviva", Priority.LOW);
        loaWithoutProvider.setProviderRef(" ");

        assertThatThrownBy(() -> service.create(noType)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.create(noTarget)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.create(loaWithoutProvider))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("providerRef");
        verifyNoInteractions(registry);
    }

    @Test
    void markReceived_applied_recordsProviderLatency() {
        ChaseItem received = TestDataFactory.createItem("CHASE-1", ChaseType.LOA, ChaseStatus.RECEIVED, Priority.MEDIUM);
        when(registry.applyExternal("CHASE-1", ChaseStatus.RECEIVED, "response_received", "Response received"))
                .thenReturn(Optional.of(CommitResult.applied(received)));

        Optional<ChaseItem> result = service.markReceived("CHASE-1", null);

        assertThat(result).contains(received);
        verify(profileService).recordResolution(received);
    }

    @Test
    void markCompleted_onResolvedItem_returnsItUnchanged() {
        ChaseItem done = TestDataFactory.createItem("CHASE-1", ChaseType.LOA, ChaseStatus.COMPLETED, Priority.MEDIUM);
        when(registry.applyExternal("CHASE-1", ChaseStatus.COMPLETED, "completed", "again"))
                .thenReturn(Optional.of(CommitResult.conflict(done)));

        assertThat(service.markCompleted("CHASE-1", "again")).contains(done);
        verifyNoInteractions(profileService);
    }

    @Test
    void markReceived_unknownItem_isEmpty() {
        when(registry.applyExternal(eq("NOPE"), any(), any(), any())).thenReturn(Optional.empty());

        assertThat(service.markReceived("NOPE", "x")).isEmpty();
    }
}
