package me.golemcore.warranty.adapter.outbound.log;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warranty.domain.model.StepTransition;
import me.golemcore.warranty.port.outbound.TransitionLogPort;
import org.springframework.stereotype.Component;

/**
 * Writes each state transition as one key=value log line.
 */
@Component
@Slf4j
public class Slf4jTransitionLogAdapter implements TransitionLogPort {

    @Override
    public void record(StepTransition transition) {
        log.info("[Transition] run={} step#={} step={} from={} to={} next={} elapsedMs={} detail=\"{}\"",
                transition.getRunId(),
                transition.getStepNumber(),
                transition.getStepId(),
                transition.getFromState(),
                transition.getToState(),
                transition.getNextStepId() != null ? transition.getNextStepId() : "-",
                transition.getElapsedMs(),
                transition.getDetail() != null ? transition.getDetail() : "");
    }
}
