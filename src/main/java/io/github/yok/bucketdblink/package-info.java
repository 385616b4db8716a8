/**
 * Root package of BucketDBLink.
 *
 * <p>
 * Provides a CLI that loads CSV files and image metadata from an object-storage bucket into
 * PostgreSQL. The object path {@code <prefix>/<database>/<schema>/<table>/<file>} selects the
 * target table.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.bucketdblink.config}: configuration models</li>
 * <li>{@code io.github.yok.bucketdblink.core}: discovery, merge, inference, provisioning and
 * load</li>
 * <li>{@code io.github.yok.bucketdblink.db}: JDBC connection factory and identifier quoting</li>
 * <li>{@code io.github.yok.bucketdblink.storage}: object storage access (Amazon S3)</li>
 * </ul>
 */
package io.github.yok.bucketdblink;
