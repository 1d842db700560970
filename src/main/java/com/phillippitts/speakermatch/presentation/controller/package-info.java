/**
 * REST controllers: service status, catalog listing and the match endpoint.
 */
package com.phillippitts.speakermatch.presentation.controller;
