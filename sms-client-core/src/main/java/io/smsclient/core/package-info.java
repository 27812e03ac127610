/**
 * Protocol-centric core for the SMS gateway client.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the gateway data model</li>
 *   <li>Immutable client configuration</li>
 *   <li>The unchecked exception hierarchy shared by all modules</li>
 * </ul>
 *
 * <p>HTTP and WebSocket bindings live in other modules.
 */
package io.smsclient.core;
