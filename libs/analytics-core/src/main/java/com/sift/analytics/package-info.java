/**
 * Usage analytics aggregation engine.
 *
 * <p>Producers publish {@link com.sift.analytics.Aggregate} payloads through
 * {@link com.sift.analytics.Analytics}. A single {@link com.sift.analytics.AggregatorActor} merges
 * payloads of the same {@link com.sift.analytics.AggregateKind} into one envelope per kind and,
 * once per flush interval, exports them to an {@link com.sift.analytics.AnalyticsSink}.
 */
package com.sift.analytics;
