/**
 * Object storage access package.
 *
 * <p>
 * {@link io.github.yok.bucketdblink.storage.ObjectStore} is the capability the loader needs from
 * a bucket: list objects and fetch object bytes. The Amazon S3 implementation lives in
 * {@code s3}.
 * </p>
 */
package io.github.yok.bucketdblink.storage;
