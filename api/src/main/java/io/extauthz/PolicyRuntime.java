/*
 * Copyright 2026 The ext-authz Authors
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
 */

package io.extauthz;

/**
 * The host process a plugin runs in. It owns the policy store, the policy engine and the decision
 * log, recompiles the policy set when it changes, and tracks the readiness of its plugins.
 */
public interface PolicyRuntime {

  PolicyStore store();

  PolicyEngine engine();

  DecisionLogger decisionLogger();

  /**
   * Registers {@code trigger} to run after every recompilation of the policy set. Triggers run
   * before the recompiled policy set is used by any new check call.
   */
  void registerCompilerTrigger(Runnable trigger);

  /** Records the readiness of the plugin called {@code pluginName}. */
  void updatePluginStatus(String pluginName, PluginState state);
}
