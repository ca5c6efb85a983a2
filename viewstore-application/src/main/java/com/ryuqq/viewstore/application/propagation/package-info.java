/**
 * Update propagation: delivery of mutation events to subscribers and live-tracking views.
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.application.propagation;
