/**
 * Contract test support: {@link com.ryuqq.viewstore.testkit.AbstractStoreContractTest} plus the
 * fixtures it uses, including the mutable {@link com.ryuqq.viewstore.testkit.MutableItem} bean for
 * ownership checks.
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.testkit;
