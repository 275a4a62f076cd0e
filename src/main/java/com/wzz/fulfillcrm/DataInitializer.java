package com.wzz.fulfillcrm;

import com.wzz.fulfillcrm.dto.CreatDTO.AccountCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.UserCreateDTO;
import com.wzz.fulfillcrm.enums.AccountType;
import com.wzz.fulfillcrm.enums.UserRole;
import com.wzz.fulfillcrm.service.AccountService;
import com.wzz.fulfillcrm.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时补齐管理员账号与默认科目表，已存在的记录不做修改
 */
@Component
@Slf4j
public class DataInitializer implements ApplicationRunner {

    private static final Object[][] DEFAULT_ACCOUNTS = {
            {"41", "商品", AccountType.ASSET},
            {"50", "现金", AccountType.ASSET},
            {"51", "结算账户", AccountType.ASSET},
            {"62", "应收客户款", AccountType.ASSET},
            {"60", "应付供应商款", AccountType.LIABILITY},
            {"90.1", "营业收入", AccountType.REVENUE},
            {"90.2", "营业成本", AccountType.EXPENSE},
            {"44.1", "仓储费用", AccountType.EXPENSE},
            {"44.2", "拣货费用", AccountType.EXPENSE},
            {"44.3", "打包费用", AccountType.EXPENSE},
            {"44.4", "配送费用", AccountType.EXPENSE},
            {"44.5", "其他服务费用", AccountType.EXPENSE},
            {"91.2", "其他支出", AccountType.EXPENSE},
            {"99", "本年利润", AccountType.EQUITY},
    };

    @Autowired
    private UserService userService;

    @Autowired
    private AccountService accountService;

    @Value("${crm.admin.email:admin@fulfillment.local}")
    private String adminEmail;

    @Value("${crm.admin.password:admin123}")
    private String adminPassword;

    @Override
    public void run(ApplicationArguments args) {
        log.info(">>> 系统启动，检查初始数据...");
        if (userService.getByEmail(adminEmail) == null) {
            UserCreateDTO admin = new UserCreateDTO();
            admin.setEmail(adminEmail);
            admin.setPassword(adminPassword);
            admin.setFirstName("System");
            admin.setLastName("Admin");
            admin.setRole(UserRole.ADMIN);
            userService.createUser(admin);
            log.info(">>> 已创建管理员账号 {}", adminEmail);
        }

        int created = 0;
        for (Object[] row : DEFAULT_ACCOUNTS) {
            String code = (String) row[0];
            if (accountService.getByCode(code) != null) {
                continue;
            }
            AccountCreateDTO dto = new AccountCreateDTO();
            dto.setCode(code);
            dto.setName((String) row[1]);
            dto.setType((AccountType) row[2]);
            accountService.createAccount(dto);
            created++;
        }
        if (created > 0) {
            log.info(">>> 已补齐默认科目 {} 个", created);
        }
    }
}
