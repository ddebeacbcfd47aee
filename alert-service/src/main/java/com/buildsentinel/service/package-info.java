/**
 * Process bootstrap for the alert engine: environment configuration, the HTTP
 * status and ingest server, and anomaly record parsing.
 */
package com.buildsentinel.service;
