package com.mouse.keeper.controller;

import com.mouse.keeper.exception.AccountConflictException;
import com.mouse.keeper.exception.AccountNotFoundException;
import com.mouse.keeper.manager.AccountPool;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.AccountUpdate;
import com.mouse.keeper.repository.AccountRepository;
import com.mouse.keeper.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class AccountControllerTest {

    private static final String JSON = "application/json";

    @Mock
    private AccountRepository repository;

    @Mock
    private AccountPool pool;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new AccountController(repository, pool))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        @DisplayName("list_returnsStoredAccounts")
        void list_returnsStoredAccounts() throws Exception {
            when(repository.findAll()).thenReturn(List.of(TestFixtures.account("a"), TestFixtures.account("b")));

            mvc.perform(get("/accounts"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2))
                    .andExpect(jsonPath("$[0].name").value("a"))
                    .andExpect(jsonPath("$[0].api_user").value("100"));
        }

        @Test
        @DisplayName("get_unknownName_404")
        void get_unknownName_404() throws Exception {
            when(repository.findByName("ghost")).thenReturn(Optional.empty());

            mvc.perform(get("/accounts/ghost"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.reason").value("account_not_found"));
        }
    }

    @Nested
    @DisplayName("write")
    class Write {

        @Test
        @DisplayName("add_newAccount_201")
        void add_newAccount_201() throws Exception {
            when(repository.add(any())).thenAnswer(inv -> inv.getArgument(0));

            mvc.perform(post("/accounts").contentType(JSON)
                            .content("{\"name\":\"c\",\"api_user\":\"7\",\"api_key\":\"sk-c\",\"cookies\":\"session=abc\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.name").value("c"))
                    .andExpect(jsonPath("$.enabled").value(true));

            ArgumentCaptor<Account> captor = ArgumentCaptor.forClass(Account.class);
            verify(repository).add(captor.capture());
            assertThat(captor.getValue().getCookies()).containsEntry("session", "abc");
        }

        @Test
        @DisplayName("add_duplicateName_409")
        void add_duplicateName_409() throws Exception {
            when(repository.add(any())).thenThrow(new AccountConflictException("Account a already exists"));

            mvc.perform(post("/accounts").contentType(JSON).content("{\"name\":\"a\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.reason").value("account_conflict"));
        }

        @Test
        @DisplayName("update_newApiKey_resetsPoolHealth")
        void update_newApiKey_resetsPoolHealth() throws Exception {
            Account updated = TestFixtures.account("a").toBuilder().apiKey("sk-new").build();
            when(repository.update(eq("a"), any())).thenReturn(updated);

            mvc.perform(put("/accounts/a").contentType(JSON).content("{\"api_key\":\"sk-new\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.api_key").value("sk-new"));

            ArgumentCaptor<AccountUpdate> captor = ArgumentCaptor.forClass(AccountUpdate.class);
            verify(repository).update(eq("a"), captor.capture());
            assertThat(captor.getValue().getEnabled()).isNull();
            verify(pool).resetHealth("a");
        }

        @Test
        @DisplayName("update_withoutApiKey_keepsPoolHealth")
        void update_withoutApiKey_keepsPoolHealth() throws Exception {
            when(repository.update(eq("a"), any())).thenReturn(TestFixtures.account("a"));

            mvc.perform(put("/accounts/a").contentType(JSON).content("{\"provider\":\"agentrouter\"}"))
                    .andExpect(status().isOk());

            verifyNoInteractions(pool);
        }

        @Test
        @DisplayName("update_unknownName_404")
        void update_unknownName_404() throws Exception {
            when(repository.update(eq("ghost"), any())).thenThrow(new AccountNotFoundException("ghost"));

            mvc.perform(put("/accounts/ghost").contentType(JSON).content("{\"api_key\":\"x\"}"))
                    .andExpect(status().isNotFound());
            verifyNoInteractions(pool);
        }

        @Test
        @DisplayName("remove_forgetsHealth")
        void remove_forgetsHealth() throws Exception {
            mvc.perform(delete("/accounts/a"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.removed").value("a"));

            verify(repository).remove("a");
            verify(pool).forget("a");
        }

        @Test
        @DisplayName("toggle_returnsFlippedAccount")
        void toggle_returnsFlippedAccount() throws Exception {
            when(repository.toggle("a")).thenReturn(TestFixtures.account("a").toBuilder().enabled(false).build());

            mvc.perform(post("/accounts/a/toggle"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.enabled").value(false));
        }
    }

    @Test
    @DisplayName("reload_reportsAccountCount")
    void reload_reportsAccountCount() throws Exception {
        when(pool.reload()).thenReturn(List.of(TestFixtures.account("a")));

        mvc.perform(post("/accounts/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accounts").value(1));
    }
}
