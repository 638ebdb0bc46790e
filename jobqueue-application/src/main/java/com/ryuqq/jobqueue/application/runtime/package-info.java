/**
 * Engine runtime entry points driven by an external periodic scheduler.
 *
 * @since 1.0.0
 * @author JobQueue Team
 */
package com.ryuqq.jobqueue.application.runtime;
