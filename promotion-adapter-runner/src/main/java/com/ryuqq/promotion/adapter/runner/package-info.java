/**
 * Runner Adapter Layer - 병렬 복사 Runner 구현체.
 *
 * <p>이 패키지는 {@code CopyRunner} 인터페이스의 병렬 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promotion.adapter.runner.BoundedParallelCopyRunner} - 고정 폭 워커 풀, 항목당 타임아웃</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BoundedParallelCopyRunner)
 *   ↓ implements
 * application (CopyRunner interface)
 *   ↓ depends on
 * core (PromotableItem, CopyOutcome, TimeoutPolicy)
 * </pre>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
package com.ryuqq.promotion.adapter.runner;
