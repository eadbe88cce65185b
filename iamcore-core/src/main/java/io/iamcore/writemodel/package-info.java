/**
 * Write models: aggregate state folded from ordered events.
 */
package io.iamcore.writemodel;
