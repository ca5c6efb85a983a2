/**
 * Update events published after mutations.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
package com.ryuqq.viewstore.core.update;
