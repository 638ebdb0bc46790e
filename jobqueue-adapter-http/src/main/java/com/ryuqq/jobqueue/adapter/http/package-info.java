/**
 * HTTP adapter: {@link com.ryuqq.jobqueue.core.spi.AsyncHttpClient} on top of the JDK
 * {@link java.net.http.HttpClient}.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
package com.ryuqq.jobqueue.adapter.http;
