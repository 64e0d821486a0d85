/**
 * TombWatch source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tombwatch.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tombwatch.cli.TombWatchCommand} maps commands to harness APIs.</li>
 *   <li>{@code io.tombwatch.harness.TombstoneHarness} runs preconditions, scenarios, verification and reporting.</li>
 *   <li>{@code io.tombwatch.scenario.ScenarioOrchestrator} drives one fault-injection scenario through its phases.</li>
 * </ul>
 */
package io.tombwatch;
