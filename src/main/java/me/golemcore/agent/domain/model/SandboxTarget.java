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

/**
 * What a tool call touches, as declared by the tool from its arguments: a
 * shell command, or a path together with the file operation performed on it.
 */
public record SandboxTarget(Kind kind, String value, String operation) {

    public enum Kind {
        COMMAND, PATH
    }

    public static SandboxTarget command(String command) {
        return new SandboxTarget(Kind.COMMAND, command, "execute");
    }

    public static SandboxTarget path(String path, String operation) {
        return new SandboxTarget(Kind.PATH, path, operation);
    }
}
