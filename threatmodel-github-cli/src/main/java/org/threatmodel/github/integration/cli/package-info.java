@NullMarked
package org.threatmodel.github.integration.cli;

import org.jspecify.annotations.NullMarked;
