/**
 * Internal implementation details of the plan-execute-replan engine.
 * <p>
 * <b>WARNING:</b> Types in this package and its sub-packages are not part of the
 * public API and may change without notice between versions. External code should
 * not depend on these types directly.
 * <p>
 * For public API types, use the top-level {@code org.javai.planexec} package.
 */
package org.javai.planexec.internal;
