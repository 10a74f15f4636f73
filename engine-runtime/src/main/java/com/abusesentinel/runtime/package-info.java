/**
 * Host process for the abuse-prevention engine: scheduled ticks, an HTTP
 * health endpoint and a JSON audit trail.
 */
package com.abusesentinel.runtime;
