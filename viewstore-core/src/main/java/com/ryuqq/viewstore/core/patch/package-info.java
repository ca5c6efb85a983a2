/**
 * Patch/diff engine over the Jackson tree form of items.
 *
 * <ul>
 *   <li>{@link com.ryuqq.viewstore.core.patch.Patch}: ordered RFC 6902 operations, apply and merge</li>
 *   <li>{@link com.ryuqq.viewstore.core.patch.Diff}: structural diff producing a patch</li>
 *   <li>{@link com.ryuqq.viewstore.core.patch.PatchSet}: per-id patches of one partial-update request</li>
 * </ul>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
package com.ryuqq.viewstore.core.patch;
