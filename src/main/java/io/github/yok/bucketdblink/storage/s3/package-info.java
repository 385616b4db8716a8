/**
 * Amazon S3 implementation of the object store (AWS SDK for Java v2).
 */
package io.github.yok.bucketdblink.storage.s3;
