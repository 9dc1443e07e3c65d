package org.jmapsuite.testkit;

import static org.jmapsuite.match.Expect.number;
import static org.jmapsuite.match.Expect.sequence;
import static org.jmapsuite.match.Expect.string;
import static org.jmapsuite.match.Expect.supersetOf;

import java.util.List;
import java.util.Map;
import org.jmapsuite.batch.EntityKind;
import org.jmapsuite.client.BatchRequest;

/**
 * Built-in Mailbox conformance tests.
 */
public final class MailboxConformanceCatalog {
    static final String CREATE_DEFAULTS = "mailbox.set.create-defaults";
    static final String CREATE_WITH_PARENT = "mailbox.set.create-with-parent";
    static final String GET_UNKNOWN_ID = "mailbox.get.unknown-id";
    static final String DESTROY = "mailbox.set.destroy";
    static final String UNKNOWN_METHOD = "core.unknown-method";

    private static final String UNKNOWN_ID = "jmap-testsuite-unknown-mailbox";

    private MailboxConformanceCatalog() {}

    public static TestRegistry registry() {
        return registerAll(new TestRegistry());
    }

    public static TestRegistry registerAll(final TestRegistry registry) {
        return registry
                .register(CREATE_DEFAULTS, MailboxConformanceCatalog::createWithDefaults)
                .register(CREATE_WITH_PARENT, MailboxConformanceCatalog::createWithParent)
                .register(GET_UNKNOWN_ID, MailboxConformanceCatalog::getUnknownId)
                .register(DESTROY, MailboxConformanceCatalog::destroy)
                .register(UNKNOWN_METHOD, MailboxConformanceCatalog::unknownMethod);
    }

    static void createWithDefaults(final TestContext context) {
        final ConformanceAsserter asserter = context.asserter();
        final AssertionOutcome created = context.require(asserter.requestAndAssert(
                "Mailbox/set",
                Map.of("create", Map.of("new", Map.of("name", "X"))),
                supersetOf("created", supersetOf("new", supersetOf("id", string()))),
                "Mailbox/set create with only a name"));
        context.check(asserter.batchOk(created.result().orElseThrow(), "Mailbox/set create batch invariants"));
        final String id = created.batch().orElseThrow().createdId("new");

        context.check(asserter.requestAndAssert(
                "Mailbox/get",
                Map.of("ids", List.of(id)),
                supersetOf(
                        "list", sequence(supersetOf(
                                "id", string(id),
                                "name", string("X"),
                                "sortOrder", number(0),
                                "totalEmails", number(0))),
                        "notFound", sequence()),
                "Mailbox/get returns server defaults for a new mailbox"));

        context.account().get(EntityKind.MAILBOX, id).ifPresent(EntityHandle::destroy);
    }

    static void createWithParent(final TestContext context) {
        final ConformanceAsserter asserter = context.asserter();
        final EntityHandle parent = context.account().createMailbox(Map.of("name", "conformance parent"));

        final AssertionOutcome created = context.require(asserter.requestAndAssert(
                "Mailbox/set",
                Map.of("create", Map.of("new", Map.of("name", "X", "parentId", parent.id(), "sortOrder", 55))),
                supersetOf("created", supersetOf("new", supersetOf("id", string()))),
                "Mailbox/set create with parentId and sortOrder"));
        context.check(asserter.batchOk(
                created.result().orElseThrow(), "Mailbox/set create-with-parent batch invariants"));
        final String id = created.batch().orElseThrow().createdId("new");

        context.check(asserter.requestAndAssert(
                "Mailbox/get",
                Map.of("ids", List.of(id)),
                supersetOf("list", sequence(supersetOf(
                        "id", string(id),
                        "name", string("X"),
                        "parentId", string(parent.id()),
                        "sortOrder", number(55)))),
                "Mailbox/get returns the given parentId and sortOrder"));

        context.account().get(EntityKind.MAILBOX, id).ifPresent(EntityHandle::destroy);
        parent.destroy();
    }

    static void getUnknownId(final TestContext context) {
        context.check(context.asserter().requestAndAssert(
                "Mailbox/get",
                Map.of("ids", List.of(UNKNOWN_ID)),
                supersetOf(
                        "accountId", string(context.account().accountId()),
                        "state", string(),
                        "list", sequence(),
                        "notFound", sequence(string(UNKNOWN_ID))),
                "Mailbox/get of an unknown id reports notFound"));
    }

    static void destroy(final TestContext context) {
        final ConformanceAsserter asserter = context.asserter();
        final EntityHandle mailbox = context.account().createMailbox(Map.of("name", "conformance destroy"));

        context.require(asserter.requestAndAssert(
                "Mailbox/set",
                Map.of("destroy", List.of(mailbox.id())),
                supersetOf(
                        "oldState", string(),
                        "newState", string(),
                        "destroyed", sequence(string(mailbox.id()))),
                "Mailbox/set destroy"));
        context.check(asserter.requestAndAssert(
                "Mailbox/get",
                Map.of("ids", List.of(mailbox.id())),
                supersetOf("list", sequence(), "notFound", sequence(string(mailbox.id()))),
                "destroyed mailbox is reported notFound"));
    }

    static void unknownMethod(final TestContext context) {
        context.check(context.asserter().requestAndAssert(
                BatchRequest.single("Mailbox/frobnicate", Map.of()),
                List.of(ExpectedResponse.error("unknownMethod")),
                "unknown method yields an unknownMethod error"));
    }
}
