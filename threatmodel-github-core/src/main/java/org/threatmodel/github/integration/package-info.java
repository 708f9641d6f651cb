/**
 * GitHub integration core package: rate-limited REST client, webhook verification and
 * processing, and repository fetch/analysis.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.threatmodel.github.integration;

import org.jspecify.annotations.NullMarked;
