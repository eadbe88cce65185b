/**
 * Resolution of the memberships and grants removed together with a user.
 *
 * @see io.iamcore.cascade.CascadeResolver
 * @see io.iamcore.user.UserCommands#removeUser
 */
package io.iamcore.cascade;
