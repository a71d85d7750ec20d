/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.adapter.outbound.approval;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ApprovalAnswer;
import me.golemcore.agent.domain.model.ApprovalRequest;
import me.golemcore.agent.domain.service.PendingApprovalRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ApprovalPort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Terminal approval prompt for the {@code cli} channel.
 *
 * <p>
 * One long-lived reader thread consumes the terminal. Each line answers the
 * oldest request that is still pending: {@code y} approves, {@code t} approves
 * and trusts the session, anything else denies. Lines typed while nothing is
 * pending are ignored. End of input denies everything waiting and every later
 * request.
 */
@Component
@Slf4j
public class ConsoleApprovalAdapter implements ApprovalPort {

    static final String CHANNEL_TYPE = "cli";

    private final AgentProperties properties;
    private final PendingApprovalRegistry registry;
    private final Deque<String> waiting = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean readerStarted = new AtomicBoolean();
    private volatile boolean inputClosed;
    private volatile BufferedReader reader;
    private volatile PrintStream out;
    private final ExecutorService readerExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "console-approval");
        t.setDaemon(true);
        return t;
    });

    public ConsoleApprovalAdapter(AgentProperties properties, PendingApprovalRegistry registry) {
        this.properties = properties;
        this.registry = registry;
        this.reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        this.out = System.out;
    }

    /**
     * Replace the terminal streams before the first prompt. Package-private for
     * testing.
     */
    void setConsole(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public boolean isAvailable() {
        AgentProperties.ChannelProperties channel = properties.getChannels().get(CHANNEL_TYPE);
        return channel != null && channel.isEnabled();
    }

    @Override
    public CompletableFuture<Boolean> requestApproval(ApprovalRequest request) {
        String sessionId = request.session() != null ? request.session().getId() : null;
        Duration timeout = Duration.ofSeconds(properties.getApproval().getTimeoutSeconds());
        PendingApprovalRegistry.PendingApproval pending = registry.open(sessionId, request.toolName(),
                request.riskLevel(), timeout);

        out.println();
        out.println("Approval required [" + request.riskLevel() + "] " + request.toolName());
        out.println("  " + request.description());
        out.print("Approve? [y]es / [n]o / [t]rust session: ");
        out.flush();

        waiting.removeIf(id -> !registry.isPending(id));
        waiting.addLast(pending.id());
        if (inputClosed) {
            registry.resolve(pending.id(), ApprovalAnswer.DENY);
        } else if (readerStarted.compareAndSet(false, true)) {
            readerExecutor.execute(this::readLoop);
        }
        return pending.future();
    }

    private void readLoop() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                dispatch(line);
            }
        } catch (IOException e) {
            log.warn("[Approval] Failed to read console answer: {}", e.getMessage());
        }
        inputClosed = true;
        log.info("[Approval] Console input closed, denying pending requests");
        String approvalId;
        while ((approvalId = waiting.pollFirst()) != null) {
            registry.resolve(approvalId, ApprovalAnswer.DENY);
        }
    }

    private void dispatch(String line) {
        String approvalId;
        while ((approvalId = waiting.pollFirst()) != null) {
            // Timed-out requests are skipped so the answer reaches the live prompt.
            if (registry.isPending(approvalId)) {
                registry.resolve(approvalId, ApprovalAnswer.parse(line));
                return;
            }
        }
        log.debug("[Approval] Ignoring console input with no pending request");
    }

    @PreDestroy
    public void shutdown() {
        readerExecutor.shutdownNow();
    }
}
