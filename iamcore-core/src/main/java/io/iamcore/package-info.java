/**
 * Event-sourced command core for identity and access management.
 *
 * <h2>Core Design</h2>
 * <p>Every mutating operation hydrates a {@link io.iamcore.writemodel.WriteModel} by replaying
 * its aggregate stream from the {@link io.iamcore.spi.EventLog}, validates its preconditions,
 * appends new events atomically and folds exactly the appended events back into the same
 * write model. The caller receives {@link io.iamcore.ObjectDetails} reflecting the state
 * after the write without a second read.
 *
 * <p>The first event of each command expects the aggregate head the command validated
 * against. A concurrent write in between fails the append with
 * {@link io.iamcore.ErrorKind#CONCURRENCY_CONFLICT}. Commands that would change nothing fail
 * with {@link io.iamcore.ErrorKind#PRECONDITION_FAILED} before touching the log.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>iamcore-core</b>: primitives, SPIs, write models, commands, cascade resolution,
 *       resource handlers and an in-memory event log</li>
 *   <li><b>iamcore-jdbc</b>: JDBC event log (H2, MySQL, PostgreSQL)</li>
 *   <li><b>iamcore-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>iamcore-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var executor = new CommandExecutor(new InMemoryEventLog());
 * var smtp = new SmtpConfigCommands(executor, AesGcmSecretProvider.fromBase64("k1", base64Key));
 * var context = CommandContext.of("admin", "instance-1");
 *
 * ObjectDetails details = smtp.addSmtpConfig(context,
 *     new SmtpConfig(true, "noreply@example.com", "Example", "smtp.example.com:587", "mailer", "secret"));
 * }</pre>
 *
 * @see io.iamcore.command.CommandExecutor
 * @see io.iamcore.spi.EventLog
 * @see io.iamcore.smtp.SmtpConfigCommands
 * @see io.iamcore.user.UserCommands
 */
package io.iamcore;
