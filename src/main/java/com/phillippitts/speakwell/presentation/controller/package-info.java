/**
 * REST controllers: analysis, rubric management and practice sentences.
 *
 * @since 1.0
 */
package com.phillippitts.speakwell.presentation.controller;
