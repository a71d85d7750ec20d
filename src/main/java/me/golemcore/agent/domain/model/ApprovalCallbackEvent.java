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
 * Published by a channel when the user answers an approval prompt.
 *
 * @param approvalId
 *            id of the pending approval
 * @param answer
 *            the user's answer
 * @param chatId
 *            chat the prompt was shown in, may be null
 * @param messageId
 *            id of the prompt message, may be null
 */
public record ApprovalCallbackEvent(String approvalId, ApprovalAnswer answer, String chatId, String messageId) {
}
