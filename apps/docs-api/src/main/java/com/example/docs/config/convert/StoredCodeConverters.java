package com.example.docs.config.convert;

import com.example.docs.access.model.AccessLevel;
import com.example.docs.access.model.SharePermission;
import com.example.docs.access.model.WorkspaceRole;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.util.List;

/**
 * Mongo converters that store roles, access levels and share permissions as their numeric codes
 * instead of enum names.
 */
public final class StoredCodeConverters {

    private StoredCodeConverters() {
        // Utility class
    }

    public static List<Converter<?, ?>> all() {
        return List.of(
                new WorkspaceRoleToCode(), new CodeToWorkspaceRole(),
                new AccessLevelToCode(), new CodeToAccessLevel(),
                new SharePermissionToCode(), new CodeToSharePermission());
    }

    @WritingConverter
    static class WorkspaceRoleToCode implements Converter<WorkspaceRole, Integer> {
        @Override
        public Integer convert(WorkspaceRole source) {
            return source.code();
        }
    }

    @ReadingConverter
    static class CodeToWorkspaceRole implements Converter<Integer, WorkspaceRole> {
        @Override
        public WorkspaceRole convert(Integer source) {
            return WorkspaceRole.fromCode(source);
        }
    }

    @WritingConverter
    static class AccessLevelToCode implements Converter<AccessLevel, Integer> {
        @Override
        public Integer convert(AccessLevel source) {
            return source.code();
        }
    }

    @ReadingConverter
    static class CodeToAccessLevel implements Converter<Integer, AccessLevel> {
        @Override
        public AccessLevel convert(Integer source) {
            return AccessLevel.fromCode(source);
        }
    }

    @WritingConverter
    static class SharePermissionToCode implements Converter<SharePermission, Integer> {
        @Override
        public Integer convert(SharePermission source) {
            return source.code();
        }
    }

    @ReadingConverter
    static class CodeToSharePermission implements Converter<Integer, SharePermission> {
        @Override
        public SharePermission convert(Integer source) {
            return SharePermission.fromCode(source);
        }
    }
}
