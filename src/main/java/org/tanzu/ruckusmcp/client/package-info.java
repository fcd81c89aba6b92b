/**
 * RUCKUS One API client core.
 *
 * <p>{@link org.tanzu.ruckusmcp.client.TokenAuthority} manages the OAuth2
 * client-credentials token, {@link org.tanzu.ruckusmcp.client.ApiGateway} sends
 * authenticated requests and turns responses into
 * {@link org.tanzu.ruckusmcp.client.ApiResult}s or typed exceptions, and
 * {@link org.tanzu.ruckusmcp.client.RuckusOneClient} ties them to the resource
 * modules.
 */
package org.tanzu.ruckusmcp.client;
