/**
 * Configuration model package for BucketDBLink.
 *
 * <p>
 * Defines immutable values bound from {@code application.yml}: the PostgreSQL server connection,
 * the source bucket and the load behavior. Values are bound once at startup and passed to each
 * component at construction.
 * </p>
 *
 * <p>
 * This package holds configuration data only; execution logic lives in {@code core}.
 * </p>
 */
package io.github.yok.bucketdblink.config;
