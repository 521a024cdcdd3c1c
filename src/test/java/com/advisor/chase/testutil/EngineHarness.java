package com.advisor.chase.testutil;

import com.advisor.chase.channel.ChannelSender;
import com.advisor.chase.channel.CommunicationDispatcher;
import com.advisor.chase.channel.MessageTemplateRenderer;
import com.advisor.chase.config.ChaseEngineConfig;
import com.advisor.chase.config.MetricsConfig;
import com.advisor.chase.engine.DelayPredictor;
import com.advisor.chase.engine.EscalationPolicy;
import com.advisor.chase.engine.agent.AgentRegistry;
import com.advisor.chase.engine.agent.DocumentChaserAgent;
import com.advisor.chase.engine.agent.LoaChaserAgent;
import com.advisor.chase.model.Activity;
import com.advisor.chase.model.SendOutcome;
import com.advisor.chase.registry.ActivityEventBus;
import com.advisor.chase.registry.ActivityLog;
import com.advisor.chase.registry.ChaseItemRegistry;
import com.advisor.chase.repository.ActivityRepository;
import com.advisor.chase.repository.ChaseItemRepository;
import com.advisor.chase.repository.ClientRepository;
import com.advisor.chase.repository.ProviderProfileRepository;
import com.advisor.chase.service.ChaseItemProcessor;
import com.advisor.chase.service.ChaseItemService;
import com.advisor.chase.service.ChaseOrchestrator;
import com.advisor.chase.service.ProviderProfileService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * The full engine wired by hand: real policy, predictor, agents, dispatcher, registry and
 * orchestrator over mocked repositories and a mocked channel sender. Jitter is off and the
 * default worker pool has a single thread, so runs are deterministic.
 */
public class EngineHarness implements AutoCloseable {

    public final MutableClock clock = new MutableClock(Instant.parse("2025-03-03T09:00:00Z"));
    public final ChaseEngineConfig config;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MetricsConfig metrics = new MetricsConfig(meterRegistry);

    public final ChaseItemRepository itemRepository = mock(ChaseItemRepository.class);
    public final ActivityRepository activityRepository = mock(ActivityRepository.class);
    public final ProviderProfileRepository profileRepository = mock(ProviderProfileRepository.class);
    public final ClientRepository clientRepository = mock(ClientRepository.class);
    public final ChannelSender channelSender = mock(ChannelSender.class);

    public final ActivityLog activityLog = new ActivityLog();
    public final ActivityEventBus eventBus;
    public final ChaseItemRegistry registry;
    public final DelayPredictor predictor;
    public final EscalationPolicy policy;
    public final ProviderProfileService profileService;
    public final AgentRegistry agentRegistry;
    public final CommunicationDispatcher dispatcher;
    public final ChaseItemProcessor processor;
    public final ExecutorService workerPool;
    public final ChaseOrchestrator orchestrator;
    public final ChaseItemService itemService;

    public EngineHarness() {
        this(new ChaseEngineConfig(), 1);
    }

    public EngineHarness(ChaseEngineConfig config, int workers) {
        this.config = config;
        this.workerPool = Executors.newFixedThreadPool(workers);
        config.getBackoff().setJitterPct(0.0);

        lenient().when(channelSender.send(any(), any(), any(), anyString())).thenReturn(SendOutcome.SUCCESS);
        lenient().when(clientRepository.findByClientId(TestDataFactory.CLIENT_ID))
                .thenReturn(TestDataFactory.createClient(TestDataFactory.CLIENT_ID));

        eventBus = new ActivityEventBus(config, metrics);
        registry = new ChaseItemRegistry(itemRepository, activityRepository, activityLog, eventBus,
                config, metrics, clock);
        predictor = new DelayPredictor(config);
        policy = new EscalationPolicy(config, new Random(42));
        profileService = new ProviderProfileService(profileRepository, config);
        agentRegistry = new AgentRegistry(List.of(
                new DocumentChaserAgent(clientRepository, clock),
                new LoaChaserAgent(clock)));
        dispatcher = new CommunicationDispatcher(new MessageTemplateRenderer(), channelSender, metrics);
        processor = new ChaseItemProcessor(registry, predictor, policy, agentRegistry, dispatcher,
                profileService, config, metrics, clock);
        orchestrator = new ChaseOrchestrator(registry, processor, predictor, profileService, workerPool,
                Tracer.NOOP, metrics, clock);
        itemService = new ChaseItemService(registry, profileService);
    }

    /**
     * Move the clock to the item's next action time (or keep it when already due) and tick.
     */
    public void tickWhenDue(String itemId) {
        long next = registry.get(itemId).orElseThrow().getNextActionAt();
        if (next > clock.millis()) {
            clock.setMillis(next);
        }
        orchestrator.tick();
    }

    public List<Activity> activities(String itemId) {
        return registry.activitiesFor(itemId);
    }

    @Override
    public void close() {
        workerPool.shutdownNow();
    }
}
