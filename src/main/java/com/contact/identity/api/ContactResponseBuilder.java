package com.contact.identity.api;

import com.contact.identity.core.model.Contact;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Assembles a {@link ContactSummary} from an already-loaded cluster. Pure.
 */
public class ContactResponseBuilder {

    /**
     * @param primary the cluster's primary
     * @param members every member in creation order; the primary may be among them
     */
    public ContactSummary build(Contact primary, List<Contact> members) {
        List<Long> secondaryIds = new ArrayList<>();
        for (Contact member : members) {
            if (member.isSecondary()) {
                secondaryIds.add(member.getId());
            }
        }
        return new ContactSummary(
                primary.getId(),
                distinct(primary, members, Contact::getEmail),
                distinct(primary, members, Contact::getPhoneNumber),
                secondaryIds);
    }

    private static List<String> distinct(Contact primary, List<Contact> members,
                                         Function<Contact, Optional<String>> field) {
        Set<String> values = new LinkedHashSet<>();
        field.apply(primary).ifPresent(values::add);
        for (Contact member : members) {
            if (member.getId() != primary.getId()) {
                field.apply(member).ifPresent(values::add);
            }
        }
        return new ArrayList<>(values);
    }
}
