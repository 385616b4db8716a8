/**
 * Core discovery and load workflow package.
 *
 * <p>
 * {@link io.github.yok.bucketdblink.core.BucketLoader} indexes the bucket with
 * {@link io.github.yok.bucketdblink.core.PathIndexer}, then for every tabular group merges the CSV
 * shards, infers column types, provisions the table and bulk-inserts the rows; image groups get a
 * fixed metadata table instead. Connections are owned by
 * {@link io.github.yok.bucketdblink.core.ConnectionManager}, one per target database.
 * </p>
 */
package io.github.yok.bucketdblink.core;
