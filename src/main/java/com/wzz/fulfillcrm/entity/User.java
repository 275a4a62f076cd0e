package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.UserRole;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 系统用户
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("sys_user")
public class User extends BaseEntity {

    /**
     * 登录邮箱，唯一
     */
    @TableField("email")
    private String email;

    /**
     * BCrypt 加密后的密码
     */
    @JsonIgnore
    @TableField("password")
    private String password;

    @TableField("first_name")
    private String firstName;

    @TableField("last_name")
    private String lastName;

    /**
     * 角色
     */
    @TableField("role")
    private UserRole role;

    @TableField("phone")
    private String phone;

    /**
     * 是否启用，停用后无法登录
     */
    @TableField("is_active")
    private Boolean isActive;
}
