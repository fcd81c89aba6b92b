/**
 * Typed errors raised by the RUCKUS One client.
 *
 * <p>{@link org.tanzu.ruckusmcp.exception.AuthenticationException} and
 * {@link org.tanzu.ruckusmcp.exception.ApiException} both extend
 * {@link org.tanzu.ruckusmcp.exception.RuckusOneException}; the API branch is
 * further split by status code.
 */
package org.tanzu.ruckusmcp.exception;
