/**
 * Controller Channel Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty UDP, a simulator, or a
 * test double) and the step protocol adapter.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used for the production UDP channel <strong>without</strong>
 * letting Netty types leak into the planner, driver, or adapter.
 * Everything above the transport sees only:
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no token interpretation)</li>
 *   <li>Not originate outbound traffic on their own</li>
 *   <li>Not retry, wait, or time out</li>
 * </ul>
 */
package com.questrail.navigation.protocol.step.transport;
