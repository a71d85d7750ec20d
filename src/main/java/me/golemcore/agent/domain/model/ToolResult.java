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

package me.golemcore.agent.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a tool call. The {@link Status} is the discriminator: a denial by
 * the security pipeline is {@link Status#DENIED}, a tool that ran and failed
 * (or could not be dispatched) is {@link Status#FAILED}.
 */
@Data
@Builder
public class ToolResult {

    public enum Status {
        OK, DENIED, FAILED
    }

    private Status status;
    private String output;
    private Object data;
    private String error;
    private ToolFailureKind failureKind;

    public boolean isSuccess() {
        return status == Status.OK;
    }

    public boolean isDenied() {
        return status == Status.DENIED;
    }

    /**
     * Text handed back to the model as the tool message content.
     */
    public String contentForModel() {
        if (status == Status.DENIED) {
            return "Denied: " + error;
        }
        if (status == Status.FAILED) {
            if (output != null && !output.isBlank()) {
                return output;
            }
            return "Error: " + error;
        }
        return output != null ? output : "";
    }

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .status(Status.OK)
                .output(output)
                .build();
    }

    /**
     * Creates a successful tool result with output text and structured data.
     */
    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .status(Status.OK)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .status(Status.FAILED)
                .error(error)
                .failureKind(kind)
                .build();
    }

    /**
     * Creates a result for a call the security pipeline refused to run.
     */
    public static ToolResult denied(ToolFailureKind kind, String reason) {
        return ToolResult.builder()
                .status(Status.DENIED)
                .error(reason)
                .failureKind(kind)
                .build();
    }
}
