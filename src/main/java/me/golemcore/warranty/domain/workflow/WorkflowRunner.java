package me.golemcore.warranty.domain.workflow;

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

import me.golemcore.warranty.domain.model.EmailMessage;
import me.golemcore.warranty.domain.model.OrchestrationResult;
import me.golemcore.warranty.domain.model.WorkflowMode;
import me.golemcore.warranty.domain.step.RunControl;

/**
 * One way of processing a warranty email end to end. Exactly one runner is
 * selected per run, by configuration.
 */
public interface WorkflowRunner {

    WorkflowMode getMode();

    OrchestrationResult run(EmailMessage email, RunControl runControl);
}
