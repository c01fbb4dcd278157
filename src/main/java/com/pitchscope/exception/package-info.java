/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so callers of the session
 * orchestrator can handle them uniformly.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.pitchscope.exception.PitchScopeException} - Base exception</li>
 *   <li>{@link com.pitchscope.exception.ConfigurationException} - Invalid audio configuration
 *       or provider settings</li>
 *   <li>{@link com.pitchscope.exception.ConnectionException} - Provider unreachable, socket
 *       failure, or non-success HTTP status</li>
 *   <li>{@link com.pitchscope.exception.ProtocolException} - Malformed provider payload or
 *       provider-reported realtime error</li>
 *   <li>{@link com.pitchscope.exception.TranscriptionTimeoutException} - Receive or poll
 *       budget exhausted</li>
 *   <li>{@link com.pitchscope.exception.InvalidTransitionException} - Disallowed session
 *       state change</li>
 *   <li>{@link com.pitchscope.exception.InactiveSessionException} - Segment added to an
 *       inactive session</li>
 *   <li>{@link com.pitchscope.exception.AudioNotAcceptedException} - Audio fed to a session
 *       that cannot receive it</li>
 *   <li>{@link com.pitchscope.exception.UpstreamJobException} - Batch job failed at the provider</li>
 *   <li>{@link com.pitchscope.exception.SizeLimitExceededException} - Audio too large for upload</li>
 *   <li>{@link com.pitchscope.exception.SessionNotFoundException} - Unknown session id</li>
 *   <li>{@link com.pitchscope.exception.SessionCancelledException} - Work interrupted by cancellation</li>
 *   <li>{@link com.pitchscope.exception.SessionFailedException} - Unrecoverable stop failure</li>
 * </ul>
 *
 * @see com.pitchscope.exception.PitchScopeException
 * @since 1.0
 */
package com.pitchscope.exception;
