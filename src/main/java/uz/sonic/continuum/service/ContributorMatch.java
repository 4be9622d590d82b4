package uz.sonic.continuum.service;

import uz.sonic.continuum.entity.AppUser;

public sealed interface ContributorMatch {

    record Matched(AppUser user) implements ContributorMatch {}

    record NoReply() implements ContributorMatch {}

    record NoMatch() implements ContributorMatch {}
}
