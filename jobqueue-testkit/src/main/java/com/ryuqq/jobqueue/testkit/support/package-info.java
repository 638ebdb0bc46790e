/**
 * Test doubles for engine tests: a settable clock and a scripted asynchronous HTTP client.
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.testkit.support;
