/**
 * Small helpers shared by the store modules.
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.core.util;
