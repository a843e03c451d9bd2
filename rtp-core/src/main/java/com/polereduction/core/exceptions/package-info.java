/**
 * Typed failures of the reduction-to-pole pipeline.
 *
 * @since 1.0.0
 */
package com.polereduction.core.exceptions;
