/**
 * Shared utilities: fatal error reporting for the command-line entry point.
 */
package io.github.yok.bucketdblink.util;
