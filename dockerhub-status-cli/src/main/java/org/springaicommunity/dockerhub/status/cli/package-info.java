/**
 * Command-line entry point for DockerHub status checks.
 */
@NullMarked
package org.springaicommunity.dockerhub.status.cli;

import org.jspecify.annotations.NullMarked;
