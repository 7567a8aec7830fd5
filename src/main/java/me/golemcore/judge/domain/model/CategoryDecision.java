package me.golemcore.judge.domain.model;

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

/**
 * Categorical decision returned by the evaluator for one issue: either the name
 * of an existing category or a proposed new one.
 */
public record CategoryDecision(String name, String description, boolean isNew) {

    public static CategoryDecision existing(String name) {
        return new CategoryDecision(name, null, false);
    }

    public static CategoryDecision proposed(String name, String description) {
        return new CategoryDecision(name, description, true);
    }
}
