// Part of Watchdigest
/*
 * Conventions shared by classes in this package:
 * - Null check is performed on method parameters where null makes no sense. Watched objects and handlers may be null.
 * - Exceptions from watched accessors are never wrapped. They are passed to digest exception handler or propagated as they are.
 * - There's no logging by default. Logging happens only when the application chooses DigestExceptionHandler.log().
 * - Metrics and tracing spans are produced only by digest passes.
 * - Groups and records have OwnerTrace alias and parent set. Their toString() uses it.
 */
/**
 * Change detector, watch groups, and watch records.
 * Watches are organized in a tree of {@link com.machinezoo.watchdigest.WatchGroup}s
 * rooted in {@link com.machinezoo.watchdigest.ChangeDetector}, which reports changes in registration order.
 */
package com.machinezoo.watchdigest;
