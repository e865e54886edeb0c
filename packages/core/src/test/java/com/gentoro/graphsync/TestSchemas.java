package com.gentoro.graphsync;

import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.LinkDirection;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.RelationshipSchema;

/** Schemas shared by the tests. */
public final class TestSchemas {
  public static final RelationshipSchema WIDGET_ACCOUNT =
      RelationshipSchema.subResource("Account", PropertyMap.of("id", Binding.kwarg("ACCOUNT_ID")));

  public static final RelationshipSchema WIDGET_TAGS =
      RelationshipSchema.of(
          "Tag", PropertyMap.of("id", Binding.rowList("tag_ids")), "TAGGED", LinkDirection.OUTWARD);

  public static final RelationshipSchema WIDGET_OWNER =
      RelationshipSchema.of(
          "Person",
          PropertyMap.of("email", Binding.row("owner_email").ignoreCase()),
          "OWNS",
          LinkDirection.INWARD);

  public static final NodeSchema ACCOUNT =
      NodeSchema.builder("Account")
          .properties(PropertyMap.of("id", Binding.row("id")))
          .scopedCleanup(false)
          .module("test")
          .build();

  public static final NodeSchema WIDGET =
      NodeSchema.builder("Widget")
          .properties(PropertyMap.of("id", Binding.row("id"), "name", Binding.row("name")))
          .subResource(WIDGET_ACCOUNT)
          .module("test")
          .build();

  public static final NodeSchema TAGGED_WIDGET =
      NodeSchema.builder("Widget")
          .properties(PropertyMap.of("id", Binding.row("id"), "name", Binding.row("name")))
          .subResource(WIDGET_ACCOUNT)
          .relationship(WIDGET_TAGS)
          .relationship(WIDGET_OWNER)
          .module("test")
          .build();

  public static final NodeSchema PROJECT =
      NodeSchema.builder("Project")
          .properties(PropertyMap.of("id", Binding.row("id")))
          .subResource(
              RelationshipSchema.subResource("Org", PropertyMap.of("id", Binding.kwarg("ORG_ID"))))
          .cascadeDelete(true)
          .build();

  public static final NodeSchema INSTANCE =
      NodeSchema.builder("Instance")
          .properties(PropertyMap.of("id", Binding.row("id")))
          .subResource(
              RelationshipSchema.subResource(
                  "Project", PropertyMap.of("id", Binding.kwarg("PROJECT_ID"))))
          .build();

  public static final MatchLinkSchema MEMBER_OF =
      MatchLinkSchema.builder("MEMBER_OF")
          .source("User", PropertyMap.of("id", Binding.row("user_id")))
          .target("Group", PropertyMap.of("id", Binding.row("group_id")))
          .module("test")
          .build();

  private TestSchemas() {}
}
