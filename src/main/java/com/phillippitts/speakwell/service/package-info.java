/**
 * Service layer containing the pronunciation engine and the services around it.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.align} - target/transcript word alignment and edit distance</li>
 *   <li>{@code service.scoring} - rubric-based scoring</li>
 *   <li>{@code service.analysis} - tokenize, align, score orchestration and events</li>
 *   <li>{@code service.rubric} - per-doctor and per-patient rubric resolution</li>
 *   <li>{@code service.transcript} - transcriber output parsing</li>
 *   <li>{@code service.exercise} - practice sentence catalog</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Engine classes are plain Java, wired as beans in {@code config.analysis}</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services are thread-safe for concurrent requests</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.service;
